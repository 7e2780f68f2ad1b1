package com.vigil.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "health-monitor");
    }

    @Test
    @DisplayName("should reject a blank service name")
    void shouldRejectBlankServiceName() {
        assertThatThrownBy(() -> new MetricFactory(registry, " "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("serviceName");
    }

    @Test
    @DisplayName("should tag counters with the service name")
    void shouldTagCounters() {
        factory.counter("vigil.alerts", "Alerts", "outcome", "sent").increment();

        assertThat(registry.get("vigil.alerts")
                .tag(MetricFactory.TAG_SERVICE, "health-monitor")
                .tag("outcome", "sent")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should return the same gauge holder for the same name and tags")
    void shouldReuseGauge() {
        AtomicLong first = factory.gauge("vigil.category.status", "Status", "category", "server");
        AtomicLong second = factory.gauge("vigil.category.status", "Status", "category", "server");
        AtomicLong other = factory.gauge("vigil.category.status", "Status", "category", "queues");

        first.set(3);

        assertThat(second).isSameAs(first);
        assertThat(other).isNotSameAs(first);
        assertThat(registry.get("vigil.category.status").tag("category", "server").gauge().value())
                .isEqualTo(3.0);
    }
}
