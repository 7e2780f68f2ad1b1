package com.vigil.healthmonitor.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.vigil.monitoring.check.CheckCategory;
import com.vigil.monitoring.check.HealthCheck;
import com.vigil.monitoring.health.HealthReporter;
import com.vigil.monitoring.metrics.MonitoringMetrics;
import com.vigil.monitoring.testing.StubHealthCheck;
import com.vigil.observability.HealthStatus;
import com.vigil.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@DisplayName("HealthController")
class HealthControllerTest {

    private ExecutorService executor;
    private SimpleMeterRegistry registry;
    private StubHealthCheck ping;
    private StubHealthCheck postgres;
    private StubHealthCheck mongo;
    private StubHealthCheck queue;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        registry = new SimpleMeterRegistry();
        ping = new StubHealthCheck("ping", CheckCategory.SERVER);
        postgres = new StubHealthCheck("postgres", CheckCategory.STORAGE);
        mongo = new StubHealthCheck("mongodb", CheckCategory.STORAGE);
        queue = new StubHealthCheck("email", CheckCategory.QUEUES);

        Map<CheckCategory, List<HealthCheck>> checks =
                Map.of(
                        CheckCategory.SERVER, List.of(ping),
                        CheckCategory.STORAGE, List.of(postgres, mongo),
                        CheckCategory.QUEUES, List.of(queue));
        var reporter =
                new HealthReporter(
                        checks, List.of(ping, postgres), executor, Duration.ofSeconds(2), Clock.systemUTC());
        var metrics = new MonitoringMetrics(new MetricFactory(registry, "health-monitor-test"));

        mockMvc = MockMvcBuilders.standaloneSetup(new HealthController(reporter, metrics)).build();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("GET /health/ready")
    class Ready {

        @Test
        @DisplayName("is 200 when every check is healthy")
        void healthyIsOk() throws Exception {
            mockMvc.perform(get("/health/ready"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.mode").value("full"))
                    .andExpect(jsonPath("$.overallStatus").value("HEALTHY"))
                    .andExpect(jsonPath("$.summary.totalChecks").value(4));
        }

        @Test
        @DisplayName("is 503 with a warning")
        void warningIsUnavailable() throws Exception {
            queue.setStatus(HealthStatus.WARNING);

            mockMvc.perform(get("/health/ready"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.overallStatus").value("WARNING"))
                    .andExpect(jsonPath("$.categories.QUEUES.status").value("WARNING"));
        }

        @Test
        @DisplayName("is 503 when only degraded")
        void degradedIsUnavailable() throws Exception {
            queue.setStatus(HealthStatus.DEGRADED);

            mockMvc.perform(get("/health/ready"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.overallStatus").value("DEGRADED"));
        }

        @Test
        @DisplayName("is 503 when a check is critical")
        void criticalIsUnavailable() throws Exception {
            mongo.setStatus(HealthStatus.CRITICAL);

            mockMvc.perform(get("/health/ready"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.overallStatus").value("CRITICAL"))
                    .andExpect(jsonPath("$.categories.STORAGE.checks[1].checkName").value("mongodb"));
        }

        @Test
        @DisplayName("is 503 when a probe throws")
        void failingProbeIsUnavailable() throws Exception {
            postgres.failWith(new IllegalStateException("pool exhausted"));

            mockMvc.perform(get("/health/ready"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.categories.STORAGE.status").value("ERROR"));
        }

        @Test
        @DisplayName("records the run in the health gauges")
        void recordsMetrics() throws Exception {
            mongo.setStatus(HealthStatus.UNHEALTHY);

            mockMvc.perform(get("/health/ready"));

            assertThat(registry.getMeters()).isNotEmpty();
            assertThat(registry.getMeters())
                    .anySatisfy(meter -> assertThat(meter.getId().getName()).startsWith("vigil.health"));
        }
    }

    @Nested
    @DisplayName("GET /health/live")
    class Live {

        @Test
        @DisplayName("only runs the quick subset")
        void runsQuickSubset() throws Exception {
            mockMvc.perform(get("/health/live"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.mode").value("quick"))
                    .andExpect(jsonPath("$.summary.totalChecks").value(2));

            assertThat(ping.invocations()).isEqualTo(1);
            assertThat(postgres.invocations()).isEqualTo(1);
            assertThat(mongo.invocations()).isZero();
            assertThat(queue.invocations()).isZero();
        }

        @Test
        @DisplayName("ignores failures outside the quick subset")
        void ignoresFullOnlyFailures() throws Exception {
            mongo.setStatus(HealthStatus.CRITICAL);

            mockMvc.perform(get("/health/live")).andExpect(status().isOk());
        }

        @Test
        @DisplayName("is 503 when relational storage is down")
        void storageDownIsUnavailable() throws Exception {
            postgres.setStatus(HealthStatus.UNHEALTHY);

            mockMvc.perform(get("/health/live"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.overallStatus").value("UNHEALTHY"));
        }

        @Test
        @DisplayName("does not touch the health gauges")
        void doesNotRecordMetrics() throws Exception {
            mockMvc.perform(get("/health/live"));

            assertThat(registry.getMeters())
                    .noneSatisfy(meter -> assertThat(meter.getId().getName()).startsWith("vigil.health"));
        }
    }
}
