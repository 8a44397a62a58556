package com.entity.reconciliation.metrics;

import java.time.Duration;

/**
 * Interface for recording reconciliation and codec metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works without a
 * meter registry.
 */
public interface MetricsService {

    void recordReconcileDuration(String modelType, String mode, Duration duration);

    void incrementStatusTransition(String modelType);

    void incrementSeedPromotion(String modelType);

    void incrementDecoded(String format, String modelType);

    void incrementDecodeFailure(String format);

    void incrementHookFailure(String modelType);
}
