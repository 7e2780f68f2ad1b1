package com.vigil.healthmonitor;

import com.vigil.healthmonitor.config.VigilProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Vigil health monitor: probes the platform, dispatches alerts, tracks issues and runs the
 * monitoring agents on demand.
 *
 * <p>Exposed surfaces:
 *
 * <ul>
 *   <li>{@code /health/live} and {@code /health/ready} for load balancers and orchestrators
 *   <li>{@code /api/v1/agents} to list and trigger agents (called by the scheduler)
 *   <li>{@code /api/v1/issues} for the issue lifecycle
 *   <li>{@code /metrics} in Prometheus text format
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(VigilProperties.class)
public class HealthMonitorApplication {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitorApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(HealthMonitorApplication.class, args);
        log.info("Vigil health monitor started");
    }
}
