package com.entity.reconciliation.registry;

/**
 * A model registered under several discriminators that specializes itself from the
 * name it was allocated with.
 */
public interface Aliasable {

    void setAlias(String alias);

    String getAlias();
}
