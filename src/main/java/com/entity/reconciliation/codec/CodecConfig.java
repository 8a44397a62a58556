package com.entity.reconciliation.codec;

/**
 * Post-decode behavior of {@link EntityCodec}.
 *
 * @param skipDefaulting do not call {@code defaulted()} on decoded models
 * @param runHooks       run the hook pipeline on decoded models, for raw input that was
 *                       never normalized
 */
public record CodecConfig(
        boolean skipDefaulting,
        boolean runHooks
) {

    public static CodecConfig defaults() {
        return new CodecConfig(false, false);
    }

    /**
     * Configuration for decoding raw, user supplied payloads.
     */
    public static CodecConfig normalizing() {
        return new CodecConfig(false, true);
    }
}
