package com.entity.reconciliation.registry;

/**
 * Thrown when a hook fails. The remaining hooks are not run and the model is left
 * partially normalized; callers must discard it.
 */
public class HookException extends RuntimeException {

    private final String hook;

    public HookException(String message) {
        super(message);
        this.hook = null;
    }

    public HookException(String message, Throwable cause) {
        super(message, cause);
        this.hook = null;
    }

    public HookException(String hook, String message, Throwable cause) {
        super("hook '" + hook + "' failed: " + message, cause);
        this.hook = hook;
    }

    /**
     * Description of the failing hook, when known.
     */
    public String getHook() {
        return hook;
    }
}
