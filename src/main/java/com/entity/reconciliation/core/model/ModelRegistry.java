package com.entity.reconciliation.core.model;

import com.entity.reconciliation.registry.TypeRegistry;

/**
 * Registers the built-in entity and relationship types.
 *
 * <p>{@link #shared()} is built once, on first use, and frozen before it is published,
 * so lookups from any thread need no locking.</p>
 */
public final class ModelRegistry {

    private ModelRegistry() {
    }

    public static TypeRegistry shared() {
        return Holder.INSTANCE;
    }

    /**
     * A new frozen registry holding the built-in types.
     */
    public static TypeRegistry create() {
        TypeRegistry registry = new TypeRegistry();
        registerAll(registry);
        registry.freeze();
        return registry;
    }

    /**
     * Adds the built-in types to a registry that is still open, so callers can add their own.
     */
    public static void registerAll(TypeRegistry registry) {
        registry.registerLabel(Labels.TTL);
        registry.registerLabel(Labels.SEED);

        registry.register(Asset::new);
        registry.register(WebApplication::new);
        registry.register(ADObject::new, ADObject.AD_LABELS.toArray(new String[0]));
        registry.register(Risk::new);
        registry.register(Port::new);
        registry.register(Attribute::new);
        registry.register(Preseed::new);

        registry.register(Discovered::new);
        registry.register(HasVulnerability::new);
        registry.register(HasAttribute::new);
        registry.register(InstanceOf::new);
        registry.registerLabel(Discovered.LABEL);
        registry.registerLabel(HasVulnerability.LABEL);
        registry.registerLabel(HasAttribute.LABEL);
        registry.registerLabel(InstanceOf.LABEL);
    }

    private static final class Holder {
        private static final TypeRegistry INSTANCE = create();
    }
}
