package com.entity.reconciliation.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs a model's hooks in declaration order, stopping at the first failure.
 */
public final class HookPipeline {
    private static final Logger log = LoggerFactory.getLogger(HookPipeline.class);

    private HookPipeline() {
    }

    /**
     * Applies {@link Model#defaulted()} and then every hook.
     */
    public static <T extends Model> T run(T model) {
        model.defaulted();
        return callHooks(model);
    }

    /**
     * Applies every hook of the model in order without defaulting.
     *
     * @throws HookException if any hook fails
     */
    public static <T extends Model> T callHooks(T model) {
        T current = model;
        List<Hook<?>> hooks = model.getHooks();
        for (Hook<?> hook : hooks) {
            current = apply(hook, current);
        }
        log.debug("hooks.applied model={} count={}", TypeRegistry.name(current), hooks.size());
        return current;
    }

    @SuppressWarnings("unchecked")
    private static <T extends Model> T apply(Hook<?> hook, T model) {
        Hook<T> typed = (Hook<T>) hook;
        T result;
        try {
            result = typed.call(model);
        } catch (HookException e) {
            log.debug("hook.failed model={} hook='{}' reason={}", TypeRegistry.name(model),
                    hook.description(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            throw new HookException(hook.description(), e.getMessage(), e);
        }
        if (result == null) {
            throw new HookException(hook.description(), "returned no model", null);
        }
        return result;
    }
}
