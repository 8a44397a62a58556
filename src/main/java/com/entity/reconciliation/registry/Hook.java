package com.entity.reconciliation.registry;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A named, fallible transformation step applied to a model.
 * The function receives the model and returns the normalized model; failures are
 * reported by throwing {@link HookException}.
 *
 * @param description what the step does, used in error messages and logs
 * @param function    the transformation
 * @param <T>         the model type the step applies to
 */
public record Hook<T extends Model>(String description, UnaryOperator<T> function) {

    public Hook {
        Objects.requireNonNull(description, "description is required");
        Objects.requireNonNull(function, "function is required");
    }

    public static <T extends Model> Hook<T> of(String description, UnaryOperator<T> function) {
        return new Hook<>(description, function);
    }

    public T call(T model) {
        return function.apply(model);
    }
}
