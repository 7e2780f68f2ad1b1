package com.vigil.healthmonitor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vigil.database.JsonColumns;
import com.vigil.database.history.JdbcHistoryStore;
import com.vigil.database.issue.JdbcIssueStore;
import com.vigil.database.migration.MonitoringFlywayConfig;
import com.vigil.healthmonitor.infrastructure.destination.ConfiguredDestinationDirectory;
import com.vigil.healthmonitor.infrastructure.notification.WebhookNotifier;
import com.vigil.healthmonitor.infrastructure.queue.RedisQueueStatsSource;
import com.vigil.healthmonitor.infrastructure.storage.JdbcStorageProbe;
import com.vigil.healthmonitor.infrastructure.storage.MongoStorageProbe;
import com.vigil.healthmonitor.infrastructure.storage.PlatformSmokeInfrastructure;
import com.vigil.healthmonitor.infrastructure.storage.RedisStorageProbe;
import com.vigil.monitoring.agent.AgentRegistry;
import com.vigil.monitoring.agent.Destination;
import com.vigil.monitoring.agent.DestinationDirectory;
import com.vigil.monitoring.agent.MonitoringAgent;
import com.vigil.monitoring.alert.AlertDispatcher;
import com.vigil.monitoring.alert.AlertPolicy;
import com.vigil.monitoring.alert.Notifier;
import com.vigil.monitoring.audit.AuditLogger;
import com.vigil.monitoring.backup.BackupHealthChecker;
import com.vigil.monitoring.backup.BackupHealthService;
import com.vigil.monitoring.backup.BackupTarget;
import com.vigil.monitoring.baseline.BaselineService;
import com.vigil.monitoring.check.CheckCategory;
import com.vigil.monitoring.check.FrontendCheck;
import com.vigil.monitoring.check.HealthCheck;
import com.vigil.monitoring.check.HttpDependencyCheck;
import com.vigil.monitoring.check.HttpProber;
import com.vigil.monitoring.check.QueueCheck;
import com.vigil.monitoring.check.RestTemplateHttpProber;
import com.vigil.monitoring.check.ServerPingCheck;
import com.vigil.monitoring.check.ServerResourcesCheck;
import com.vigil.monitoring.check.StorageBackendCheck;
import com.vigil.monitoring.correlation.CorrelationEngine;
import com.vigil.monitoring.correlation.CorrelationSources;
import com.vigil.monitoring.health.HealthReporter;
import com.vigil.monitoring.history.HistoryStore;
import com.vigil.monitoring.issue.AgentIssueTracker;
import com.vigil.monitoring.issue.IssueStore;
import com.vigil.monitoring.metrics.MonitoringMetrics;
import com.vigil.monitoring.smoke.SmokeTestRunner;
import com.vigil.monitoring.smoke.SmokeTestSettings;
import com.vigil.observability.MetricFactory;
import com.vigil.observability.SensitiveDataRedactor;
import com.vigil.observability.SpanHelper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import javax.sql.DataSource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Wires the framework-free monitoring core into the Spring context: stores, probes, alerting,
 * issue tracking, the analytical services and the agent registry.
 */
@Configuration
@Import(MonitoringFlywayConfig.class)
public class MonitoringConfig {

    static final String STORAGE_RELATIONAL = "postgres";
    static final String STORAGE_DOCUMENT = "mongodb";
    static final String STORAGE_CACHE = "redis";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ---- observability ----

    @Bean
    public SpanHelper spanHelper(ObjectProvider<OpenTelemetry> openTelemetry, VigilProperties properties) {
        OpenTelemetry otel = openTelemetry.getIfAvailable(GlobalOpenTelemetry::get);
        return new SpanHelper(otel.getTracer("vigil-" + properties.service().name()));
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, VigilProperties properties) {
        return new MetricFactory(registry, properties.service().name());
    }

    @Bean
    public MonitoringMetrics monitoringMetrics(MetricFactory metricFactory) {
        return new MonitoringMetrics(metricFactory);
    }

    // ---- persistence ----

    @Bean
    public JsonColumns jsonColumns(ObjectMapper objectMapper) {
        return new JsonColumns(objectMapper);
    }

    @Bean
    public HistoryStore historyStore(JdbcTemplate jdbcTemplate, JsonColumns jsonColumns) {
        return new JdbcHistoryStore(jdbcTemplate, jsonColumns);
    }

    @Bean
    public IssueStore issueStore(JdbcTemplate jdbcTemplate, JsonColumns jsonColumns) {
        return new JdbcIssueStore(jdbcTemplate, jsonColumns);
    }

    @Bean
    public AuditLogger auditLogger(HistoryStore historyStore, Clock clock) {
        return new AuditLogger(historyStore, new SensitiveDataRedactor(), clock);
    }

    // ---- probes ----

    @Bean
    public HttpProber httpProber(VigilProperties properties) {
        return new RestTemplateHttpProber(
                "Vigil-" + properties.service().name() + "/" + properties.service().version());
    }

    @Bean
    public JdbcStorageProbe jdbcStorageProbe(DataSource dataSource, VigilProperties properties) {
        return new JdbcStorageProbe(dataSource, properties.checks().pingTimeout());
    }

    @Bean
    public MongoClientSettingsBuilderCustomizer mongoProbeTimeouts(VigilProperties properties) {
        return mongoTimeouts(properties.checks().pingTimeout());
    }

    /** Bounds server selection and connects so a down document store fails inside a health run. */
    static MongoClientSettingsBuilderCustomizer mongoTimeouts(Duration timeout) {
        long millis = timeout.toMillis();
        return builder -> builder
                .applyToClusterSettings(cluster -> cluster.serverSelectionTimeout(millis, TimeUnit.MILLISECONDS))
                .applyToSocketSettings(socket -> socket.connectTimeout((int) millis, TimeUnit.MILLISECONDS));
    }

    @Bean
    public MongoStorageProbe mongoStorageProbe(MongoTemplate mongoTemplate) {
        return new MongoStorageProbe(mongoTemplate);
    }

    @Bean
    public RedisStorageProbe redisStorageProbe(RedisConnectionFactory connectionFactory) {
        return new RedisStorageProbe(connectionFactory);
    }

    @Bean
    public RedisQueueStatsSource queueStatsSource(StringRedisTemplate redis, VigilProperties properties) {
        return new RedisQueueStatsSource(redis, properties.checks().queuePrefix());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService healthCheckExecutor(VigilProperties properties) {
        return Executors.newFixedThreadPool(
                properties.checks().threads(), new CustomizableThreadFactory("health-probe-"));
    }

    @Bean
    public HealthReporter healthReporter(
            VigilProperties properties,
            DestinationDirectory destinations,
            HttpProber prober,
            JdbcStorageProbe jdbcProbe,
            MongoStorageProbe mongoProbe,
            RedisStorageProbe redisProbe,
            RedisQueueStatsSource queueStats,
            ExecutorService healthCheckExecutor,
            Clock clock) {
        VigilProperties.Checks checks = properties.checks();

        HealthCheck ping = new ServerPingCheck(checks.serverHost(), checks.pingTimeout());
        HealthCheck relational = new StorageBackendCheck(STORAGE_RELATIONAL, jdbcProbe);
        HealthCheck cache = new StorageBackendCheck(STORAGE_CACHE, redisProbe);

        Map<CheckCategory, List<HealthCheck>> full = new EnumMap<>(CheckCategory.class);
        full.put(CheckCategory.SERVER, List.of(ping, new ServerResourcesCheck()));
        full.put(
                CheckCategory.STORAGE,
                List.of(relational, new StorageBackendCheck(STORAGE_DOCUMENT, mongoProbe), cache));

        List<HealthCheck> external = new ArrayList<>();
        HealthCheck primary = null;
        for (VigilProperties.Endpoint endpoint : checks.dependencies()) {
            HealthCheck check =
                    new HttpDependencyCheck(endpoint.name(), endpoint.url(), checks.httpTimeout(), prober);
            external.add(check);
            if (endpoint.equals(checks.primary())) {
                primary = check;
            }
        }
        full.put(CheckCategory.EXTERNAL, external);

        List<HealthCheck> frontends = new ArrayList<>();
        for (Destination destination : destinations.getActiveDestinations()) {
            if (destination.domain() != null && !destination.domain().isBlank()) {
                frontends.add(
                        new FrontendCheck(
                                destination.code(), URI.create(destination.domain()), checks.httpTimeout(), prober));
            }
        }
        full.put(CheckCategory.FRONTENDS, frontends);
        full.put(
                CheckCategory.QUEUES,
                checks.queues().stream().map(queue -> (HealthCheck) new QueueCheck(queue, queueStats)).toList());

        List<HealthCheck> quick = new ArrayList<>(List.of(ping, relational, cache));
        if (primary != null) {
            quick.add(primary);
        }
        return new HealthReporter(full, quick, healthCheckExecutor, checks.checkTimeout(), clock);
    }

    // ---- alerting and issues ----

    @Bean
    public Notifier notifier(RestTemplateBuilder restTemplateBuilder, VigilProperties properties) {
        return new WebhookNotifier(
                restTemplateBuilder
                        .setConnectTimeout(properties.checks().httpTimeout())
                        .setReadTimeout(properties.checks().httpTimeout())
                        .build(),
                properties.alerting().webhookUrl());
    }

    @Bean
    public AlertDispatcher alertDispatcher(
            Notifier notifier, VigilProperties properties, MonitoringMetrics metrics, Clock clock) {
        AlertPolicy policy =
                new AlertPolicy(properties.alerting().urgency(), properties.alerting().cooldowns());
        return new AlertDispatcher(notifier, policy, clock, metrics::recordDispatch);
    }

    @Bean
    public AgentIssueTracker agentIssueTracker(IssueStore issueStore, MonitoringMetrics metrics, Clock clock) {
        return new AgentIssueTracker(issueStore, clock, metrics::recordIssue);
    }

    // ---- analytical services ----

    @Bean
    public BaselineService baselineService(
            HistoryStore historyStore, AgentIssueTracker issues, VigilProperties properties) {
        return new BaselineService(historyStore, issues, properties.anomaly().checklist());
    }

    @Bean
    public CorrelationEngine correlationEngine(HistoryStore historyStore, IssueStore issueStore, Clock clock) {
        return new CorrelationEngine(historyStore, issueStore, CorrelationSources.defaults(), clock);
    }

    @Bean
    public BackupHealthChecker backupHealthChecker(VigilProperties properties, Clock clock) {
        VigilProperties.Backup backup = properties.backup();
        List<BackupTarget> targets =
                backup.targets().stream().map(entry -> toTarget(entry, backup.mongoUri())).toList();
        return new BackupHealthChecker(
                backup.directory(), targets, backup.diskRoot(), backup.trackedDirectories(), clock);
    }

    @Bean
    public BackupHealthService backupHealthService(
            BackupHealthChecker checker, HistoryStore historyStore, AlertDispatcher dispatcher) {
        return new BackupHealthService(checker, historyStore, dispatcher);
    }

    @Bean
    public SmokeTestRunner smokeTestRunner(
            HttpProber prober,
            RedisStorageProbe redisProbe,
            MongoTemplate mongoTemplate,
            RedisQueueStatsSource queueStats,
            DestinationDirectory destinations,
            HistoryStore historyStore,
            AlertDispatcher dispatcher,
            ObjectMapper objectMapper,
            VigilProperties properties,
            Clock clock) {
        VigilProperties.Smoke smoke = properties.smoke();
        SmokeTestSettings settings =
                new SmokeTestSettings(
                        smoke.apiBaseUrl(),
                        null,
                        null,
                        null,
                        null,
                        null,
                        0,
                        0,
                        smoke.minScheduledJobs(),
                        smoke.timeout(),
                        null,
                        smoke.alertChannel(),
                        smoke.requiredChannelVariables());
        PlatformSmokeInfrastructure infrastructure =
                new PlatformSmokeInfrastructure(
                        redisProbe, mongoTemplate, queueStats, properties.checks().queues());
        return new SmokeTestRunner(
                prober,
                infrastructure,
                settings,
                destinations,
                historyStore,
                dispatcher,
                System.getenv(),
                objectMapper,
                clock);
    }

    // ---- agents ----

    @Bean
    public DestinationDirectory destinationDirectory(VigilProperties properties) {
        return new ConfiguredDestinationDirectory(properties.destinations());
    }

    @Bean
    public AgentRegistry agentRegistry(
            DestinationDirectory destinations,
            SpanHelper spanHelper,
            Clock clock,
            List<MonitoringAgent> agents,
            MonitoringMetrics metrics,
            AuditLogger auditLogger) {
        return new AgentRegistry(
                destinations,
                spanHelper,
                clock,
                agents,
                run -> {
                    metrics.recordAgentRun(run);
                    auditLogger.logAgent(
                            run.agentKey(),
                            AgentRunAudit.ACTION,
                            AgentRunAudit.describe(run),
                            AgentRunAudit.metadata(run));
                });
    }

    static BackupTarget toTarget(VigilProperties.BackupTargetEntry entry, String mongoUri) {
        return switch (entry.kind()) {
            case SQL -> entry.pattern() != null
                    ? new BackupTarget(entry.type(), Pattern.compile(entry.pattern()), false)
                    : BackupTarget.sqlDumps(entry.type());
            case MONGO -> BackupTarget.mongoArchives(entry.type(), mongoUri);
            case PATTERN -> {
                if (entry.pattern() == null || entry.pattern().isBlank()) {
                    throw new IllegalArgumentException("pattern must not be null for backup target " + entry.type());
                }
                yield new BackupTarget(entry.type(), Pattern.compile(entry.pattern()), false);
            }
        };
    }
}
