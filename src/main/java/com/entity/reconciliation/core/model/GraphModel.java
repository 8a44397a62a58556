package com.entity.reconciliation.core.model;

import com.entity.reconciliation.registry.Labeled;
import com.entity.reconciliation.registry.Model;

/**
 * A model persisted as a graph node under a canonical key.
 */
public interface GraphModel extends Model, Labeled {

    /**
     * Canonical identity, derived by the hook pipeline.
     */
    String getKey();

    /**
     * Whether the model is well formed enough to be persisted. Callers must check this
     * before writing; a false result is not an error by itself.
     */
    boolean valid();
}
