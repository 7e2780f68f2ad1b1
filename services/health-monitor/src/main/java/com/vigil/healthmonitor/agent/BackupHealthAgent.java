package com.vigil.healthmonitor.agent;

import com.vigil.monitoring.agent.AgentDescriptor;
import com.vigil.monitoring.agent.AgentOutcome;
import com.vigil.monitoring.agent.SharedAgent;
import com.vigil.monitoring.backup.BackupCheck;
import com.vigil.monitoring.backup.BackupHealthReport;
import com.vigil.monitoring.backup.BackupHealthService;
import com.vigil.observability.HealthStatus;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(40)
public class BackupHealthAgent implements SharedAgent {

    private static final AgentDescriptor DESCRIPTOR =
            new AgentDescriptor(
                    BackupHealthService.AGENT_NAME, "Backup Health", "Backup recency and disk", "A", "1.0.0", false);

    private final BackupHealthService service;

    public BackupHealthAgent(BackupHealthService service) {
        this.service = service;
    }

    @Override
    public AgentDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public AgentOutcome execute() {
        BackupHealthReport report = service.run();
        Map<String, Object> details = new LinkedHashMap<>();
        for (BackupCheck backup : report.backups()) {
            details.put(backup.type(), backup.status().name());
        }
        details.put("diskUsedPercent", report.disk().usedPercent());
        String summary = "Backups " + report.overall();
        return report.overall() == HealthStatus.CRITICAL
                ? AgentOutcome.failure(summary, details)
                : AgentOutcome.success(summary, details);
    }
}
