package com.entity.reconciliation.core.model;

/**
 * Folds another observation of the same entity into this one.
 *
 * @param <T> the observation type
 */
public interface Reconcilable<T> {

    /**
     * Authoritative update: non-empty fields of {@code update} win, empty ones are ignored.
     */
    void merge(T update);

    /**
     * Passive re-observation: collections are unioned and status only moves forward.
     */
    void visit(T observation);
}
