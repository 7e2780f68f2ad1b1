package com.vigil.healthmonitor.config;

import com.vigil.monitoring.baseline.MetricCheck;
import com.vigil.observability.HealthStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of the health monitor, bound from the {@code vigil.*} prefix and
 * validated at startup.
 *
 * <pre>
 * vigil:
 *   service:
 *     name: health-monitor
 *     environment: production
 *   checks:
 *     server-host: 10.0.0.12
 *     queues: [email, sync]
 *   alerting:
 *     webhook-url: http://notifications:3004/api/v1/notify
 *     cooldowns:
 *       5: 10m
 *   destinations:
 *     - id: "1"
 *       code: calpe
 *       domain: https://calpe.example.com
 * </pre>
 *
 * @param service      identity used for logging, metrics and tracing
 * @param checks       probe targets and timeouts
 * @param alerting     notifier endpoint and urgency / cooldown overrides
 * @param destinations tenants served by the platform
 * @param backup       backup directory, targets and disk paths
 * @param smoke        smoke test endpoints and the alert channel to verify
 * @param anomaly      metrics watched by the anomaly detector
 */
@ConfigurationProperties(prefix = "vigil")
@Validated
public record VigilProperties(
        @NotNull @Valid Service service,
        @Valid Checks checks,
        @Valid Alerting alerting,
        List<@Valid DestinationEntry> destinations,
        @Valid Backup backup,
        @Valid Smoke smoke,
        @Valid Anomaly anomaly) {

    public VigilProperties {
        checks = checks != null ? checks : new Checks(null, null, null, null, 0, null, null, null, null);
        alerting = alerting != null ? alerting : new Alerting(null, null, null);
        destinations = destinations != null ? List.copyOf(destinations) : List.of();
        backup = backup != null ? backup : new Backup(null, null, null, null, null);
        smoke = smoke != null ? smoke : new Smoke(null, 0, null, null, null);
        anomaly = anomaly != null ? anomaly : new Anomaly(null);
    }

    /**
     * @param name        service name used for logging, metrics and tracing. Required.
     * @param environment deployment environment (development, staging, production)
     * @param version     reported in the user agent of outbound probes
     */
    public record Service(@NotBlank String name, String environment, String version) {

        public Service {
            if (environment == null || environment.isBlank()) {
                environment = "development";
            }
            if (version == null || version.isBlank()) {
                version = "1.0.0";
            }
        }
    }

    /**
     * @param serverHost        host pinged by the server probe
     * @param pingTimeout       reachability timeout of the ping probe
     * @param checkTimeout      upper bound for any single probe inside a health run
     * @param httpTimeout       timeout of dependency and front-end requests
     * @param threads           size of the probe executor
     * @param dependencies      external status endpoints
     * @param primaryDependency dependency included in the quick check; first dependency when unset
     * @param queues            job queue names
     * @param queuePrefix       key prefix of the queue backend in Redis
     */
    public record Checks(
            String serverHost,
            Duration pingTimeout,
            Duration checkTimeout,
            Duration httpTimeout,
            int threads,
            List<@Valid Endpoint> dependencies,
            String primaryDependency,
            List<String> queues,
            String queuePrefix) {

        public Checks {
            serverHost = serverHost != null && !serverHost.isBlank() ? serverHost : "localhost";
            pingTimeout = pingTimeout != null ? pingTimeout : Duration.ofSeconds(5);
            checkTimeout = checkTimeout != null ? checkTimeout : Duration.ofSeconds(15);
            httpTimeout = httpTimeout != null ? httpTimeout : Duration.ofSeconds(10);
            threads = threads > 0 ? threads : 16;
            dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
            queues = queues != null ? List.copyOf(queues) : List.of();
            queuePrefix = queuePrefix != null && !queuePrefix.isBlank() ? queuePrefix : "bull";
        }

        /** The dependency probed by the quick check, if any is configured. */
        public Endpoint primary() {
            return dependencies.stream()
                    .filter(endpoint -> endpoint.name().equals(primaryDependency))
                    .findFirst()
                    .orElse(dependencies.isEmpty() ? null : dependencies.get(0));
        }
    }

    public record Endpoint(@NotBlank String name, @NotNull URI url) {}

    /**
     * @param webhookUrl notification service endpoint; alerts are only logged when unset
     * @param urgency    status to urgency overrides
     * @param cooldowns  urgency to cooldown overrides
     */
    public record Alerting(URI webhookUrl, Map<HealthStatus, Integer> urgency, Map<Integer, Duration> cooldowns) {

        public Alerting {
            webhookUrl = webhookUrl != null && !webhookUrl.toString().isBlank() ? webhookUrl : null;
            urgency = urgency != null ? Map.copyOf(urgency) : Map.of();
            cooldowns = cooldowns != null ? Map.copyOf(cooldowns) : Map.of();
        }
    }

    /**
     * @param active inactive destinations are skipped by fan-out runs but can still be targeted
     */
    public record DestinationEntry(@NotBlank String id, @NotBlank String code, String name, String domain,
                                   Boolean active) {

        public DestinationEntry {
            name = name != null ? name : code;
            active = active != null ? active : Boolean.TRUE;
        }
    }

    /**
     * @param directory          directory holding the backup files
     * @param diskRoot           mount whose usage is checked
     * @param trackedDirectories directories whose size is recorded for trend
     * @param mongoUri           connection string of the document store; Atlas means cloud-managed backups
     * @param targets            backup types to look for
     */
    public record Backup(Path directory, Path diskRoot, List<Path> trackedDirectories, String mongoUri,
                         List<@Valid BackupTargetEntry> targets) {

        public Backup {
            directory = directory != null ? directory : Path.of("/root/backups");
            diskRoot = diskRoot != null ? diskRoot : Path.of("/");
            trackedDirectories = trackedDirectories != null ? List.copyOf(trackedDirectories) : List.of();
            targets = targets != null && !targets.isEmpty()
                    ? List.copyOf(targets)
                    : List.of(new BackupTargetEntry("postgres", BackupKind.SQL, null),
                            new BackupTargetEntry("mongodb", BackupKind.MONGO, null));
        }
    }

    public enum BackupKind { SQL, MONGO, PATTERN }

    /**
     * @param pattern file name regex; required for {@link BackupKind#PATTERN}
     */
    public record BackupTargetEntry(@NotBlank String type, BackupKind kind, String pattern) {

        public BackupTargetEntry {
            kind = kind != null ? kind : BackupKind.SQL;
        }
    }

    /**
     * @param apiBaseUrl               platform API probed by the smoke tests
     * @param minScheduledJobs         minimum number of repeatable jobs expected in the queue backend
     * @param timeout                  timeout of a smoke request
     * @param alertChannel             cost-incurring channel whose configuration is verified
     * @param requiredChannelVariables environment variables the channel needs
     */
    public record Smoke(URI apiBaseUrl, @Min(0) long minScheduledJobs, Duration timeout, String alertChannel,
                        List<String> requiredChannelVariables) {

        public Smoke {
            apiBaseUrl = apiBaseUrl != null ? apiBaseUrl : URI.create("http://localhost:3001");
            requiredChannelVariables = requiredChannelVariables != null
                    ? List.copyOf(requiredChannelVariables)
                    : List.of("SMS_API_TOKEN", "SMS_SENDER", "ALERT_PHONE_NUMBER");
        }
    }

    public record Anomaly(List<@Valid MetricEntry> metrics) {

        public Anomaly {
            metrics = metrics != null && !metrics.isEmpty() ? List.copyOf(metrics) : defaultMetrics();
        }

        public List<MetricCheck> checklist() {
            return metrics.stream()
                    .map(entry -> MetricCheck.of(entry.agent(), entry.action(), entry.metric(), entry.label()))
                    .toList();
        }

        private static List<MetricEntry> defaultMetrics() {
            return List.of(
                    new MetricEntry("ux-ui-reviewer", "performance_check", "averageTtfbMs", "Average TTFB"),
                    new MetricEntry("security-reviewer", "security_scan", "vulnerabilities.total",
                            "Total vulnerabilities"),
                    new MetricEntry("code-reviewer", "code_scan", "debugStatements", "Debug statements"),
                    new MetricEntry("health-monitor", "health_check", "executionTimeMs", "Health check duration"),
                    new MetricEntry("backup-health", "backup_health_check", "disk.usedPercent", "Disk usage"));
        }
    }

    public record MetricEntry(@NotBlank String agent, @NotBlank String action, @NotBlank String metric,
                              String label) {}
}
