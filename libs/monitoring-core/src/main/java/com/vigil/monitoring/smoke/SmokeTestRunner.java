package com.vigil.monitoring.smoke;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vigil.monitoring.agent.Destination;
import com.vigil.monitoring.agent.DestinationDirectory;
import com.vigil.monitoring.alert.AlertDispatcher;
import com.vigil.monitoring.alert.AlertRequest;
import com.vigil.monitoring.check.HttpProbeResponse;
import com.vigil.monitoring.check.HttpProber;
import com.vigil.monitoring.history.HistoryEntry;
import com.vigil.monitoring.history.HistoryStore;
import com.vigil.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Read-only synthetic end-to-end checks.
 * <p>
 * Per destination: API health, resource list (non-empty array), detail of the first listed
 * resource (must carry a name), its sub-resource, and the destination's public front-end (200 and
 * at least {@code frontendMinBytes} of body). When the list test fails, detail and sub-resource are
 * recorded as failed "Skipped" results without being executed. Shared infrastructure (cache,
 * document store, scheduled jobs) is tested once per run. Only GET requests are issued.
 */
public final class SmokeTestRunner {

    private static final Logger log = LoggerFactory.getLogger(SmokeTestRunner.class);

    public static final String AGENT_NAME = "health-monitor";
    public static final String ACTION = "smoke_tests_completed";

    static final String API_HEALTH = "API Health";
    static final String RESOURCE_LIST = "Resource List";
    static final String RESOURCE_DETAIL = "Resource Detail";
    static final String SUB_RESOURCE = "Sub-resource";
    static final String FRONTEND = "Frontend";
    static final String CACHE = "Cache";
    static final String DOCUMENT_STORE = "Document Store";
    static final String SCHEDULED_JOBS = "Scheduled Jobs";

    @FunctionalInterface
    private interface SmokeTest {
        Map<String, Object> run() throws Exception;
    }

    private final HttpProber prober;
    private final SmokeInfrastructure infrastructure;
    private final SmokeTestSettings settings;
    private final DestinationDirectory directory;
    private final HistoryStore history;
    private final AlertDispatcher dispatcher;
    private final Map<String, String> environment;
    private final ObjectMapper objectMapper;
    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();
    private final Clock clock;

    public SmokeTestRunner(HttpProber prober, SmokeInfrastructure infrastructure, SmokeTestSettings settings,
                           DestinationDirectory directory, HistoryStore history, AlertDispatcher dispatcher,
                           Map<String, String> environment, ObjectMapper objectMapper, Clock clock) {
        this.prober = prober;
        this.infrastructure = infrastructure;
        this.settings = settings;
        this.directory = directory;
        this.history = history;
        this.dispatcher = dispatcher;
        this.environment = environment;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Runs the five per-destination tests.
     */
    public SmokeSuiteReport runDestinationTests(Destination destination) {
        List<SmokeTestResult> results = new ArrayList<>();
        Map<String, String> headers = Map.of(settings.destinationHeader(), destination.code());
        AtomicReference<String> firstResourceId = new AtomicReference<>();

        results.add(runTest(API_HEALTH, () -> {
            HttpProbeResponse response = prober.get(apiUri(settings.healthPath(), null), headers, settings.timeout());
            expectOk(response);
            return Map.of("status", response.statusCode());
        }));

        results.add(runTest(RESOURCE_LIST, () -> {
            URI uri = UriComponentsBuilder.fromUri(apiUri(settings.resourceListPath(), null))
                    .queryParam("destination_id", destination.id())
                    .queryParam("limit", settings.listLimit())
                    .build()
                    .toUri();
            HttpProbeResponse response = prober.get(uri, headers, settings.slowTimeout());
            expectOk(response);
            JsonNode items = unwrap(objectMapper.readTree(response.body()));
            if (!items.isArray()) {
                throw new IllegalStateException("Response data is not an array");
            }
            if (items.isEmpty()) {
                throw new IllegalStateException("No resources returned");
            }
            JsonNode id = items.get(0).get("id");
            if (id == null || id.isNull()) {
                throw new IllegalStateException("First resource has no id");
            }
            firstResourceId.set(id.asText());
            return Map.of("status", response.statusCode(), "count", items.size());
        }));

        String resourceId = firstResourceId.get();
        if (resourceId != null) {
            results.add(runTest(RESOURCE_DETAIL, () -> {
                HttpProbeResponse response = prober.get(apiUri(settings.resourceDetailPath(), resourceId), headers,
                        settings.timeout());
                expectOk(response);
                JsonNode name = unwrap(objectMapper.readTree(response.body())).get("name");
                if (name == null || name.isNull() || name.asText().isBlank()) {
                    throw new IllegalStateException("Resource has no name property");
                }
                return Map.of("status", response.statusCode(), "name", name.asText());
            }));
            results.add(runTest(SUB_RESOURCE, () -> {
                HttpProbeResponse response = prober.get(apiUri(settings.subResourcePath(), resourceId), headers,
                        settings.timeout());
                expectOk(response);
                return Map.of("status", response.statusCode());
            }));
        } else {
            results.add(SmokeTestResult.skipped(RESOURCE_DETAIL, "no resource from " + RESOURCE_LIST));
            results.add(SmokeTestResult.skipped(SUB_RESOURCE, "no resource from " + RESOURCE_LIST));
        }

        results.add(runTest(FRONTEND, () -> {
            if (destination.domain() == null) {
                throw new IllegalStateException("Destination has no front-end domain");
            }
            HttpProbeResponse response = prober.get(URI.create(destination.domain()), settings.slowTimeout());
            expectOk(response);
            if (response.bodyLength() < settings.frontendMinBytes()) {
                throw new IllegalStateException("Response body too small: " + response.bodyLength() + " bytes");
            }
            return Map.of("status", response.statusCode(), "bodyBytes", response.bodyLength());
        }));

        SmokeSuiteReport report = new SmokeSuiteReport(destination.id(), clock.instant(), results);
        log.info("Smoke {}: {}/{} passed", destination.code(), report.testsPassed(), report.testsTotal());
        return report;
    }

    /**
     * Runs the shared infrastructure tests once.
     */
    public SmokeSuiteReport runInfrastructureTests() {
        List<SmokeTestResult> results = new ArrayList<>();
        results.add(runTest(CACHE, () -> {
            String reply = infrastructure.pingCache();
            if (!"PONG".equalsIgnoreCase(reply)) {
                throw new IllegalStateException("Expected PONG, got " + reply);
            }
            return Map.of("status", "connected");
        }));
        results.add(runTest(DOCUMENT_STORE, () -> {
            Map<String, Object> stats = infrastructure.documentStoreStats();
            if (!isTruthy(stats.get("ok"))) {
                throw new IllegalStateException("Document store stats not ok");
            }
            Object collections = stats.get("collections");
            return collections != null ? Map.of("ok", true, "collections", collections) : Map.of("ok", true);
        }));
        results.add(runTest(SCHEDULED_JOBS, () -> {
            long count = infrastructure.scheduledJobCount();
            if (count < settings.minScheduledJobs()) {
                throw new IllegalStateException("Expected >= " + settings.minScheduledJobs() + " jobs, got " + count);
            }
            return Map.of("jobCount", count);
        }));
        SmokeSuiteReport report = new SmokeSuiteReport(null, clock.instant(), results);
        log.info("Infrastructure smoke: {}/{} passed", report.testsPassed(), report.testsTotal());
        return report;
    }

    /**
     * Verifies that the alert channel's variables are present without sending anything.
     */
    public ChannelConfigCheck checkAlertChannelConfig() {
        List<String> missing = new ArrayList<>();
        Map<String, String> masked = new LinkedHashMap<>();
        for (String variable : settings.requiredChannelVariables()) {
            String value = environment.get(variable);
            if (value == null || value.isBlank()) {
                missing.add(variable);
            } else if (!redactor.isSensitive(variable)) {
                masked.put(variable, SensitiveDataRedactor.mask(value, 3));
            }
        }
        if (!missing.isEmpty()) {
            log.warn("Alert channel {} NOT CONFIGURED, missing {}", settings.alertChannel(), missing);
            return new ChannelConfigCheck(settings.alertChannel(), ChannelConfigCheck.Status.NOT_CONFIGURED,
                    Map.of(), missing);
        }
        return new ChannelConfigCheck(settings.alertChannel(), ChannelConfigCheck.Status.CONFIGURED, masked, List.of());
    }

    /**
     * Runs every destination, the infrastructure tests and the channel check, persists the run and
     * alerts when anything failed (urgency 4 above three failures, 3 otherwise).
     */
    public SmokeTestReport runAllSmokeTests() {
        long start = System.nanoTime();
        List<SmokeSuiteReport> destinations = new ArrayList<>();
        for (Destination destination : directory.getActiveDestinations()) {
            destinations.add(runDestinationTests(destination));
        }
        SmokeTestReport report = new SmokeTestReport(clock.instant(), destinations, runInfrastructureTests(),
                checkAlertChannelConfig(), (System.nanoTime() - start) / 1_000_000);

        persist(report);
        if (report.totalFailed() > 0) {
            int urgency = report.totalFailed() > 3 ? 4 : 3;
            dispatcher.dispatch(new AlertRequest("smoke:failures", urgency,
                    "Smoke tests: " + report.totalFailed() + " failures",
                    "Failed: " + String.join(", ", report.failedTestNames()) + ". "
                            + report.totalPassed() + "/" + report.totalTests() + " passed.",
                    "smoke_tests", Map.of("failed", report.totalFailed(), "total", report.totalTests())));
        }
        log.info("All smoke tests complete: {}/{} passed", report.totalPassed(), report.totalTests());
        return report;
    }

    /**
     * The most recent persisted smoke test run, if any.
     */
    public Optional<HistoryEntry> getLatestResult() {
        return history.latest(AGENT_NAME, ACTION);
    }

    private SmokeTestResult runTest(String name, SmokeTest test) {
        long start = System.nanoTime();
        try {
            Map<String, Object> details = test.run();
            return new SmokeTestResult(name, true, (System.nanoTime() - start) / 1_000_000, null, details);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.debug("Smoke test {} failed: {}", name, error);
            return new SmokeTestResult(name, false, (System.nanoTime() - start) / 1_000_000, error, Map.of());
        }
    }

    private void persist(SmokeTestReport report) {
        try {
            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("totalTests", report.totalTests());
            metrics.put("totalPassed", report.totalPassed());
            metrics.put("totalFailed", report.totalFailed());
            metrics.put("failures", report.failedTestNames());
            metrics.put("channelStatus", report.channelConfig().status().name());
            Map<String, Object> perDestination = new LinkedHashMap<>();
            for (SmokeSuiteReport suite : report.destinations()) {
                perDestination.put(suite.destinationId(), Map.of("passed", suite.testsPassed(), "failed", suite.testsFailed()));
            }
            metrics.put("destinations", perDestination);
            history.append(HistoryEntry.of(AGENT_NAME, ACTION, report.timestamp(),
                    report.totalFailed() == 0 ? "completed" : "failed",
                    "Smoke tests: " + report.totalPassed() + "/" + report.totalTests() + " passed, "
                            + report.totalFailed() + " failed", metrics));
        } catch (RuntimeException e) {
            log.warn("Could not persist smoke test run: {}", e.getMessage(), e);
        }
    }

    private URI apiUri(String path, String resourceId) {
        String resolved = resourceId != null ? path.replace("{id}", resourceId) : path;
        return UriComponentsBuilder.fromUri(settings.apiBaseUrl()).path(resolved).build().toUri();
    }

    private static void expectOk(HttpProbeResponse response) {
        if (response.statusCode() != 200) {
            throw new IllegalStateException("Expected 200, got " + response.statusCode());
        }
    }

    private static JsonNode unwrap(JsonNode body) {
        if (body.isObject()) {
            for (String field : List.of("data", "items", "results")) {
                JsonNode nested = body.get(field);
                if (nested != null && !nested.isNull()) {
                    return nested;
                }
            }
        }
        return body;
    }

    private static boolean isTruthy(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        return value != null && !"".equals(value) && !"false".equals(value);
    }
}
