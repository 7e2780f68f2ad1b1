package com.vigil.healthmonitor.agent;

import com.vigil.monitoring.agent.AgentDescriptor;
import com.vigil.monitoring.agent.AgentOutcome;
import com.vigil.monitoring.agent.SharedAgent;
import com.vigil.monitoring.baseline.BaselineService;
import com.vigil.monitoring.baseline.BatchAnomalyReport;
import java.util.Map;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(50)
public class AnomalyDetectionAgent implements SharedAgent {

    private static final AgentDescriptor DESCRIPTOR =
            new AgentDescriptor(
                    BaselineService.AGENT_NAME, "Anomaly Detection", "Baseline deviations", "B", "1.0.0", false);

    private final BaselineService baselines;

    public AnomalyDetectionAgent(BaselineService baselines) {
        this.baselines = baselines;
    }

    @Override
    public AgentDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public AgentOutcome execute() {
        BatchAnomalyReport report = baselines.runBatchAnomalyCheck();
        String summary =
                report.anomalies().size() + " anomalies in " + report.checked() + " metrics, "
                        + report.skipped().size() + " skipped";
        Map<String, Object> details =
                Map.of(
                        "anomalies", report.anomalies().size(),
                        "skipped", report.skipped(),
                        "errors", report.errors(),
                        "autoClosed", report.autoClosed());
        return report.errors().isEmpty()
                ? AgentOutcome.success(summary, details)
                : AgentOutcome.failure(summary, details);
    }
}
