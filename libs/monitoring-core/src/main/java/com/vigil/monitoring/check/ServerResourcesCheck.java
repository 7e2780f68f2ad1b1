package com.vigil.monitoring.check;

import com.vigil.observability.HealthStatus;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * CPU load (normalized by core count) and memory usage of the host. Above 90% is critical, above
 * 85% a warning; the worse of the two readings wins.
 */
public final class ServerResourcesCheck extends AbstractTimedCheck {

    static final double CRITICAL_PERCENT = 90.0;
    static final double WARNING_PERCENT = 85.0;

    private final Supplier<ResourceSample> sampler;

    public ServerResourcesCheck() {
        this(ServerResourcesCheck::sampleOperatingSystem);
    }

    public ServerResourcesCheck(Supplier<ResourceSample> sampler) {
        super("resources", CheckCategory.SERVER);
        this.sampler = sampler;
    }

    @Override
    protected ProbeOutcome probe() {
        ResourceSample sample = sampler.get();
        double cpu = sample.cpuPercent();
        double memory = sample.memoryPercent();

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("cpuPercent", round(cpu));
        metrics.put("memoryPercent", round(memory));
        metrics.put("loadAverage", sample.loadAverage());
        metrics.put("cores", sample.cores());

        HealthStatus status = HealthStatus.worst(classify(cpu), classify(memory));
        if (status == HealthStatus.HEALTHY) {
            return ProbeOutcome.of(status, metrics);
        }
        return new ProbeOutcome(status, String.format("cpu %.1f%%, memory %.1f%%", cpu, memory), metrics);
    }

    static HealthStatus classify(double percent) {
        if (percent > CRITICAL_PERCENT) {
            return HealthStatus.CRITICAL;
        }
        if (percent > WARNING_PERCENT) {
            return HealthStatus.WARNING;
        }
        return HealthStatus.HEALTHY;
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    static ResourceSample sampleOperatingSystem() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        long total = 0;
        long free = 0;
        if (os instanceof com.sun.management.OperatingSystemMXBean extended) {
            total = extended.getTotalMemorySize();
            free = extended.getFreeMemorySize();
        }
        return new ResourceSample(os.getSystemLoadAverage(), os.getAvailableProcessors(), total, free);
    }
}
