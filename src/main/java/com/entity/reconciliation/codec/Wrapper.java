package com.entity.reconciliation.codec;

import com.entity.reconciliation.registry.Model;
import com.entity.reconciliation.registry.TypeRegistry;

import java.util.Objects;

/**
 * A model together with its discriminator, the {@code {"type": ..., "model": {...}}} envelope.
 * The bound of {@code T} picks the wrapper shape: {@code GraphModel}, {@code Target} or
 * {@code GraphRelationship}.
 */
public record Wrapper<T extends Model>(String type, T model) {

    public Wrapper {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(model, "model is required");
    }

    public static <T extends Model> Wrapper<T> of(T model) {
        return new Wrapper<>(TypeRegistry.name(model), model);
    }
}
