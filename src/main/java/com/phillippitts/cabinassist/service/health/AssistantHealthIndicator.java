package com.phillippitts.cabinassist.service.health;

import com.phillippitts.cabinassist.service.orchestration.AssistantOrchestrator;
import com.phillippitts.cabinassist.service.orchestration.OrchestratorStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Health indicator for the assistant, built from the orchestrator's committed health report.
 *
 * <ul>
 *   <li>UP: orchestrator active and every component healthy</li>
 *   <li>DEGRADED: orchestrator active but at least one component unhealthy</li>
 *   <li>DOWN: orchestrator not active (starting, stopped or failed)</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class AssistantHealthIndicator implements HealthIndicator {

    private final AssistantOrchestrator orchestrator;

    public AssistantHealthIndicator(AssistantOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Health health() {
        OrchestratorStatus status = orchestrator.getStatus();
        HealthReport report = orchestrator.getCommittedHealth();
        List<String> unhealthy = report.unhealthyComponents();

        Health.Builder builder = new Health.Builder();
        if (status != OrchestratorStatus.ACTIVE) {
            builder.down().withDetail("status", "Orchestrator " + status.name().toLowerCase());
            Throwable cause = orchestrator.getFailureCause();
            if (cause != null) {
                builder.withDetail("cause", cause.getClass().getSimpleName());
            }
        } else if (unhealthy.isEmpty()) {
            builder.up().withDetail("status", "All components operational");
        } else {
            builder.status("DEGRADED")
                    .withDetail("status", "Degraded components")
                    .withDetail("unhealthy", unhealthy);
        }
        builder.withDetail("conversation", orchestrator.getConversationState().name());
        for (Map.Entry<String, ComponentHealth> entry : report.components().entrySet()) {
            builder.withDetail(entry.getKey(), entry.getValue().status().name().toLowerCase());
        }
        return builder.build();
    }
}
