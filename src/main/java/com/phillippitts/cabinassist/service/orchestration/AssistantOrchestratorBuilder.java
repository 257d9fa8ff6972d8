package com.phillippitts.cabinassist.service.orchestration;

import com.phillippitts.cabinassist.config.properties.ConversationProperties;
import com.phillippitts.cabinassist.config.properties.HealthProperties;
import com.phillippitts.cabinassist.config.properties.RecoveryProperties;
import com.phillippitts.cabinassist.service.conversation.ConversationCoordinator;
import com.phillippitts.cabinassist.service.dispatch.VehicleEventDispatcher;
import com.phillippitts.cabinassist.service.health.ComponentHealthMonitor;
import com.phillippitts.cabinassist.service.lifecycle.AssistantComponents;
import com.phillippitts.cabinassist.service.lifecycle.ProviderCallGuard;
import com.phillippitts.cabinassist.service.recovery.RecoveryManager;
import com.phillippitts.cabinassist.service.security.IntegrityVerifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Builder for {@link AssistantOrchestrator}, which has too many collaborators for a readable
 * constructor.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * AssistantOrchestrator orchestrator = AssistantOrchestratorBuilder.builder()
 *     .components(components)
 *     .integrityVerifier(verifier)
 *     .healthMonitor(healthMonitor)
 *     .recoveryManager(recoveryManager)
 *     .coordinator(coordinator)
 *     .dispatcher(dispatcher)
 *     .guard(guard)
 *     .scheduler(scheduler)
 *     .workerExecutor(workerExecutor)
 *     .ownedPool(workerExecutor)
 *     .conversationProperties(conversationProps)
 *     .healthProperties(healthProps)
 *     .recoveryProperties(recoveryProps)
 *     .build();
 * }</pre>
 *
 * <p>All dependencies are required except {@link #ownedPool(ThreadPoolTaskExecutor)} and
 * {@link #clock(Clock)} (defaults to the UTC system clock).
 *
 * @since 1.0
 */
public final class AssistantOrchestratorBuilder {

    AssistantComponents components;
    IntegrityVerifier integrityVerifier;
    ComponentHealthMonitor healthMonitor;
    RecoveryManager recoveryManager;
    ConversationCoordinator coordinator;
    VehicleEventDispatcher dispatcher;
    ProviderCallGuard guard;
    TaskScheduler scheduler;
    Executor workerExecutor;
    final List<ThreadPoolTaskExecutor> ownedPools = new ArrayList<>();
    ConversationProperties conversationProperties;
    HealthProperties healthProperties;
    RecoveryProperties recoveryProperties;
    Clock clock = Clock.systemUTC();

    private AssistantOrchestratorBuilder() {
    }

    public static AssistantOrchestratorBuilder builder() {
        return new AssistantOrchestratorBuilder();
    }

    public AssistantOrchestratorBuilder components(AssistantComponents components) {
        this.components = components;
        return this;
    }

    public AssistantOrchestratorBuilder integrityVerifier(IntegrityVerifier integrityVerifier) {
        this.integrityVerifier = integrityVerifier;
        return this;
    }

    public AssistantOrchestratorBuilder healthMonitor(ComponentHealthMonitor healthMonitor) {
        this.healthMonitor = healthMonitor;
        return this;
    }

    public AssistantOrchestratorBuilder recoveryManager(RecoveryManager recoveryManager) {
        this.recoveryManager = recoveryManager;
        return this;
    }

    public AssistantOrchestratorBuilder coordinator(ConversationCoordinator coordinator) {
        this.coordinator = coordinator;
        return this;
    }

    public AssistantOrchestratorBuilder dispatcher(VehicleEventDispatcher dispatcher) {
        this.dispatcher = dispatcher;
        return this;
    }

    public AssistantOrchestratorBuilder guard(ProviderCallGuard guard) {
        this.guard = guard;
        return this;
    }

    /**
     * Scheduler that drives {@link AssistantOrchestrator#tick()} at a fixed delay.
     */
    public AssistantOrchestratorBuilder scheduler(TaskScheduler scheduler) {
        this.scheduler = scheduler;
        return this;
    }

    /**
     * Pool used for concurrent component start-up.
     */
    public AssistantOrchestratorBuilder workerExecutor(Executor workerExecutor) {
        this.workerExecutor = workerExecutor;
        return this;
    }

    /**
     * Registers a pool the orchestrator releases as the last step of shutdown.
     */
    public AssistantOrchestratorBuilder ownedPool(ThreadPoolTaskExecutor pool) {
        this.ownedPools.add(pool);
        return this;
    }

    public AssistantOrchestratorBuilder conversationProperties(ConversationProperties conversationProperties) {
        this.conversationProperties = conversationProperties;
        return this;
    }

    public AssistantOrchestratorBuilder healthProperties(HealthProperties healthProperties) {
        this.healthProperties = healthProperties;
        return this;
    }

    public AssistantOrchestratorBuilder recoveryProperties(RecoveryProperties recoveryProperties) {
        this.recoveryProperties = recoveryProperties;
        return this;
    }

    public AssistantOrchestratorBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * @throws NullPointerException if a required dependency is missing
     */
    public AssistantOrchestrator build() {
        return new AssistantOrchestrator(this);
    }
}
