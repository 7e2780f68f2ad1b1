package com.vigil.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates Micrometer meters that all carry a {@code service} tag.
 * <p>
 * Gauges are cached per name and tag set: asking twice for the same gauge returns the same
 * backing {@link AtomicLong}, so callers can update a gauge without holding on to it.
 */
public final class MetricFactory {

    /** Tag key for the emitting service. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;
    private final Map<String, AtomicLong> gauges = new ConcurrentHashMap<>();

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
     * Returns the counter with the given name and extra tags (key/value pairs).
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(tags(tags))
                .register(registry);
    }

    /**
     * Returns the timer with the given name and extra tags (key/value pairs).
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(tags(tags))
                .register(registry);
    }

    /**
     * Returns the value holder behind a gauge, registering the gauge on first use.
     *
     * @param name        gauge name
     * @param description human-readable description
     * @param tags        extra tags as key/value pairs
     * @return the holder to update
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        Tags allTags = tags(tags);
        return gauges.computeIfAbsent(name + allTags, key -> {
            AtomicLong value = new AtomicLong();
            Gauge.builder(name, value, AtomicLong::doubleValue)
                    .description(description)
                    .tags(allTags)
                    .register(registry);
            return value;
        });
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags tags(String... extra) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        return extra.length > 0 ? tags.and(extra) : tags;
    }
}
