package com.entity.reconciliation.core.model;

/**
 * A model whose status changes are recorded in a {@link History}.
 */
public interface StatusTracked {

    String getStatus();

    History getHistory();
}
