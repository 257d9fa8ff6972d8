package com.phillippitts.cabinassist.service.orchestration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Binds the orchestrator to the Spring context lifecycle: started once the context is refreshed,
 * shut down when it closes.
 *
 * <p>A failed startup leaves the orchestrator in {@link OrchestratorStatus#FAILED} but keeps the
 * application running, so the status endpoint and the actuator health report the failure.
 */
public class AssistantLifecycle implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(AssistantLifecycle.class);

    private final AssistantOrchestrator orchestrator;
    private final boolean autoStart;
    private volatile boolean running;

    public AssistantLifecycle(AssistantOrchestrator orchestrator, boolean autoStart) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.autoStart = autoStart;
    }

    @Override
    public void start() {
        running = true;
        try {
            orchestrator.start();
        } catch (RuntimeException e) {
            LOG.error("Assistant failed to start ({}): {}",
                    ErrorPolicy.classify(e), e.getMessage());
        }
    }

    @Override
    public void stop() {
        orchestrator.shutdown();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }
}
