package com.entity.reconciliation.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code entity.reconcile.duration}: Timer (tags: modelType, mode)</li>
 *   <li>{@code entity.status.transition}: Counter (tag: modelType)</li>
 *   <li>{@code entity.seed.promotion}: Counter (tag: modelType)</li>
 *   <li>{@code entity.decoded}: Counter (tags: format, modelType)</li>
 *   <li>{@code entity.decode.failure}: Counter (tag: format)</li>
 *   <li>{@code entity.hook.failure}: Counter (tag: modelType)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordReconcileDuration(String modelType, String mode, Duration duration) {
        String key = modelType + ":" + mode;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("entity.reconcile.duration")
                        .description("Duration of merge and visit operations")
                        .tag("modelType", modelType)
                        .tag("mode", mode)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementStatusTransition(String modelType) {
        counter("entity.status.transition", "Number of recorded status transitions",
                "modelType", modelType).increment();
    }

    @Override
    public void incrementSeedPromotion(String modelType) {
        counter("entity.seed.promotion", "Number of entities promoted to seed",
                "modelType", modelType).increment();
    }

    @Override
    public void incrementDecoded(String format, String modelType) {
        String key = "entity.decoded:" + format + ":" + modelType;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("entity.decoded")
                        .description("Number of entities decoded")
                        .tag("format", format)
                        .tag("modelType", modelType)
                        .register(registry)).increment();
    }

    @Override
    public void incrementDecodeFailure(String format) {
        counter("entity.decode.failure", "Number of rejected envelopes", "format", format).increment();
    }

    @Override
    public void incrementHookFailure(String modelType) {
        counter("entity.hook.failure", "Number of failed hook pipelines", "modelType", modelType).increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        String key = name + ":" + tagValue;
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
