package com.warden.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Creates Micrometer meters that all carry a {@code service} tag.
 * <p>
 * Meters are registered idempotently by Micrometer: asking twice for the same name and tags
 * returns the same instance.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * @param tags additional tags as key-value pairs
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(tagsWith(tags))
                .register(registry);
    }

    /**
     * @param tags additional tags as key-value pairs
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(tagsWith(tags))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags tagsWith(String... extraTags) {
        if (extraTags.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key-value pairs");
        }
        return Tags.of(TAG_SERVICE, serviceName).and(extraTags);
    }
}
