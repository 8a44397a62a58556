package com.entity.reconciliation.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordReconcileDuration(String modelType, String mode, Duration duration) {
    }

    @Override
    public void incrementStatusTransition(String modelType) {
    }

    @Override
    public void incrementSeedPromotion(String modelType) {
    }

    @Override
    public void incrementDecoded(String format, String modelType) {
    }

    @Override
    public void incrementDecodeFailure(String format) {
    }

    @Override
    public void incrementHookFailure(String modelType) {
    }
}
