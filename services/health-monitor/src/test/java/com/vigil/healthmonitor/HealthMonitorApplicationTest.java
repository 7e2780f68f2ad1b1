package com.vigil.healthmonitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.vigil.healthmonitor.config.VigilProperties;
import com.vigil.monitoring.agent.AgentRegistry;
import com.vigil.monitoring.issue.AgentIssue;
import com.vigil.monitoring.issue.AgentIssueTracker;
import com.vigil.monitoring.issue.IssueSeverity;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.actuate.observability.AutoConfigureObservability;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Boots the whole service against an in-memory H2 monitoring database. MongoDB and Redis point at
 * a closed port, so storage probes fail fast.
 */
@SpringBootTest
@AutoConfigureMockMvc
@AutoConfigureObservability
@ActiveProfiles("test")
@DisplayName("Health Monitor Application")
class HealthMonitorApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;
    @Autowired private AgentIssueTracker tracker;

    @Test
    @DisplayName("Spring context loads with every agent registered")
    void contextLoads() {
        assertThat(context.getBean(AgentRegistry.class).all())
                .extracting("key")
                .containsExactly(
                        "health-monitor",
                        "smoke-tests",
                        "destination-smoke",
                        "backup-health",
                        "anomaly-detection",
                        "correlation-engine");
    }

    @Test
    @DisplayName("properties are loaded from the test profile")
    void propertiesAreLoaded() {
        var props = context.getBean(VigilProperties.class);
        assertThat(props.service().name()).isEqualTo("health-monitor-test");
        assertThat(props.service().environment()).isEqualTo("test");
        assertThat(props.destinations()).hasSize(2);
    }

    @Nested
    @DisplayName("agents API")
    class Agents {

        @Test
        @DisplayName("lists the catalog")
        void listsAgents() throws Exception {
            mockMvc.perform(get("/api/v1/agents"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$", hasSize(6)))
                    .andExpect(jsonPath("$[2].key").value("destination-smoke"))
                    .andExpect(jsonPath("$[2].destinationAware").value(true));
        }

        @Test
        @DisplayName("runs a shared agent and reports the aggregated outcome")
        void runsSharedAgent() throws Exception {
            mockMvc.perform(post("/api/v1/agents/anomaly-detection/run"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.agentKey").value("anomaly-detection"))
                    .andExpect(jsonPath("$.category").value("B"))
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.destinationsTotal").value(1));
        }

        @Test
        @DisplayName("only fans out to active destinations")
        void fansOutToActiveDestinations() throws Exception {
            mockMvc.perform(post("/api/v1/agents/destination-smoke/run").param("destination", "all"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.destinationsTotal").value(1))
                    .andExpect(jsonPath("$.perDestination[0].destinationId").value("1"))
                    .andExpect(jsonPath("$.success").value(false));
        }

        @Test
        @DisplayName("an unknown destination is a failed run, not an error response")
        void unknownDestinationIsFailedRun() throws Exception {
            mockMvc.perform(post("/api/v1/agents/destination-smoke/run").param("destination", "atlantis"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error").value("Unknown destination: atlantis"));
        }

        @Test
        @DisplayName("an unknown agent is 404 with a problem detail")
        void unknownAgentIs404() throws Exception {
            mockMvc.perform(post("/api/v1/agents/ghost/run").header("X-Correlation-ID", "cid-404"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.title").value("Not Found"))
                    .andExpect(jsonPath("$.detail").value("Unknown agent: ghost"))
                    .andExpect(jsonPath("$.correlationId").value("cid-404"));
        }

        @Test
        @DisplayName("a critical backup run is persisted and readable as the latest check")
        void backupRunIsPersisted() throws Exception {
            mockMvc.perform(post("/api/v1/agents/backup-health/run"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(false));

            mockMvc.perform(get("/api/v1/reports/backups/latest"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.agentName").value("backup-health"))
                    .andExpect(jsonPath("$.status").value("critical"));
        }
    }

    @Nested
    @DisplayName("issues API")
    class Issues {

        private AgentIssue raise() {
            return tracker.raiseIssue(
                    "health-monitor",
                    "test:" + UUID.randomUUID(),
                    IssueSeverity.HIGH,
                    "health",
                    "redis is UNHEALTHY",
                    "Connection refused",
                    Map.of(),
                    null);
        }

        @Test
        @DisplayName("walks an issue through acknowledge, start and resolve")
        void lifecycle() throws Exception {
            String id = raise().issueId();

            mockMvc.perform(post("/api/v1/issues/{id}/acknowledge", id))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("ACKNOWLEDGED"));
            mockMvc.perform(post("/api/v1/issues/{id}/start", id))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("IN_PROGRESS"));
            mockMvc.perform(
                            post("/api/v1/issues/{id}/resolve", id)
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content("{\"note\":\"Restarted redis\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("RESOLVED"))
                    .andExpect(jsonPath("$.resolution").value("Restarted redis"));

            mockMvc.perform(get("/api/v1/issues/{id}", id))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("RESOLVED"));
        }

        @Test
        @DisplayName("an illegal transition is 409")
        void illegalTransitionIsConflict() throws Exception {
            String id = raise().issueId();
            tracker.markWontFix(id, "known flake");

            mockMvc.perform(post("/api/v1/issues/{id}/acknowledge", id))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.title").value("Conflict"));
        }

        @Test
        @DisplayName("a blank resolution note is rejected")
        void blankNoteIsRejected() throws Exception {
            String id = raise().issueId();

            mockMvc.perform(
                            post("/api/v1/issues/{id}/resolve", id)
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content("{\"note\":\"\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title").value("Validation Error"));
        }

        @Test
        @DisplayName("an unknown issue is 404")
        void unknownIssueIs404() throws Exception {
            mockMvc.perform(get("/api/v1/issues/ISSUE-19990101-001"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.detail").value("Issue not found: ISSUE-19990101-001"));
        }

        @Test
        @DisplayName("filters open issues by severity and rejects unknown severities")
        void filtersBySeverity() throws Exception {
            String id = raise().issueId();

            mockMvc.perform(get("/api/v1/issues").param("severity", "high").param("agent", "health-monitor"))
                    .andExpect(status().isOk())
                    .andExpect(content().string(containsString(id)));
            mockMvc.perform(get("/api/v1/issues").param("severity", "catastrophic"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("Unknown severity: catastrophic"));
        }

        @Test
        @DisplayName("reports statistics")
        void reportsStats() throws Exception {
            raise();

            mockMvc.perform(get("/api/v1/issues/stats"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.activeBySeverity.HIGH").isNumber());
        }
    }

    @Test
    @DisplayName("liveness is 503 while the cache is unreachable")
    void livenessReflectsUnreachableCache() throws Exception {
        mockMvc.perform(get("/health/live"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.mode").value("quick"))
                .andExpect(jsonPath("$.categories.STORAGE.status").value("UNHEALTHY"));
    }

    @Test
    @DisplayName("the monitoring schema is migrated at startup")
    void schemaIsMigrated() throws Exception {
        mockMvc.perform(get("/api/v1/reports/migrations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentVersion").value("1"))
                .andExpect(jsonPath("$.pendingMigrations").value(0));
    }

    @Test
    @DisplayName("metrics are exposed in Prometheus text format")
    void metricsAreScraped() throws Exception {
        mockMvc.perform(post("/api/v1/agents/anomaly-detection/run")).andExpect(status().isOk());

        mockMvc.perform(get("/metrics"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("vigil_agent_runs_total")))
                .andExpect(content().string(containsString("agent=\"anomaly-detection\"")));
    }

    @Test
    @DisplayName("correlation ID header is set on responses")
    void correlationIdHeaderIsSet() throws Exception {
        mockMvc.perform(get("/api/v1/agents"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Correlation-ID"));
    }
}
