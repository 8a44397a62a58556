package com.entity.reconciliation.registry;

import java.util.List;

/**
 * A model that is stored as a labeled graph node.
 */
public interface Labeled {

    List<String> getLabels();
}
