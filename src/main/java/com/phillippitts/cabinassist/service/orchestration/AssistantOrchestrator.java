package com.phillippitts.cabinassist.service.orchestration;

import com.phillippitts.cabinassist.config.properties.ConversationProperties;
import com.phillippitts.cabinassist.config.properties.HealthProperties;
import com.phillippitts.cabinassist.config.properties.RecoveryProperties;
import com.phillippitts.cabinassist.domain.ConversationContext;
import com.phillippitts.cabinassist.exception.CabinAssistException;
import com.phillippitts.cabinassist.exception.ComponentFailureException;
import com.phillippitts.cabinassist.exception.IntegrityCheckException;
import com.phillippitts.cabinassist.exception.RecoveryFailedException;
import com.phillippitts.cabinassist.service.conversation.ConversationCoordinator;
import com.phillippitts.cabinassist.service.conversation.ConversationState;
import com.phillippitts.cabinassist.service.dispatch.VehicleEventDispatcher;
import com.phillippitts.cabinassist.service.health.ComponentHealth;
import com.phillippitts.cabinassist.service.health.ComponentHealthMonitor;
import com.phillippitts.cabinassist.service.health.ComponentStatus;
import com.phillippitts.cabinassist.service.health.HealthReport;
import com.phillippitts.cabinassist.service.lifecycle.AssistantComponents;
import com.phillippitts.cabinassist.service.lifecycle.ComponentNames;
import com.phillippitts.cabinassist.service.lifecycle.ComponentRegistry;
import com.phillippitts.cabinassist.service.lifecycle.ManagedComponent;
import com.phillippitts.cabinassist.service.lifecycle.ProviderCallGuard;
import com.phillippitts.cabinassist.service.recovery.ComponentFailureEvent;
import com.phillippitts.cabinassist.service.recovery.ComponentRecoveredEvent;
import com.phillippitts.cabinassist.service.recovery.RecoveryManager;
import com.phillippitts.cabinassist.service.recovery.RecoveryResult;
import com.phillippitts.cabinassist.service.security.IntegrityVerifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Top-level coordinator of the assistant: startup, steady-state loop, failure handling and shutdown.
 *
 * <p><b>Startup</b> ({@link #start()}):
 * <ol>
 *   <li>Integrity verification; failure aborts startup with {@link IntegrityCheckException}</li>
 *   <li>All components started concurrently on the worker pool</li>
 *   <li>Vehicle events routed to the dispatcher, transcriptions to the coordinator</li>
 *   <li>Health check; unhealthy components go through recovery</li>
 *   <li>Recovery failure triggers emergency shutdown ({@link RecoveryFailedException}); otherwise
 *       the orchestrator becomes ACTIVE and starts the tick and the conversation consumer</li>
 * </ol>
 *
 * <p><b>Steady state</b> ({@link #tick()}, fixed delay of {@code conversation.tick-interval}):
 * refreshes vehicle state into the context, polls the wake word while idle, enforces the
 * listening timeout, recovers components reported as failed and runs the periodic health check.
 * Non-fatal tick errors pause the loop for {@code conversation.error-backoff}.
 *
 * <p><b>Shutdown</b> ({@link #shutdown()}, {@link #emergencyShutdown(Throwable)}): stops the tick and
 * the consumer, stops components in reverse start order, stops the integrity verifier, then releases
 * the owned thread pools. Idempotent; the first call wins.
 *
 * <p><b>Health ownership:</b> the health monitor proposes reports; this class commits them, and
 * marks components DEGRADED as {@link ComponentFailureEvent}s arrive.
 *
 * @see AssistantOrchestratorBuilder
 */
public class AssistantOrchestrator {

    private static final Logger LOG = LogManager.getLogger(AssistantOrchestrator.class);

    private final AssistantComponents components;
    private final ComponentRegistry registry;
    private final IntegrityVerifier integrityVerifier;
    private final ComponentHealthMonitor healthMonitor;
    private final RecoveryManager recoveryManager;
    private final ConversationCoordinator coordinator;
    private final VehicleEventDispatcher dispatcher;
    private final ProviderCallGuard guard;
    private final TaskScheduler scheduler;
    private final Executor workerExecutor;
    private final List<ThreadPoolTaskExecutor> ownedPools;
    private final ConversationProperties conversationProperties;
    private final Duration healthCheckInterval;
    private final Duration startTimeout;
    private final Clock clock;

    private final AtomicReference<OrchestratorStatus> status = new AtomicReference<>(OrchestratorStatus.CREATED);
    private final AtomicBoolean shutdownStarted = new AtomicBoolean(false);
    private final AtomicReference<HealthReport> committedHealth;
    private final Set<String> pendingRecovery = ConcurrentHashMap.newKeySet();

    private volatile ScheduledFuture<?> tickFuture;
    private volatile Instant nextHealthCheck;
    private volatile Instant backoffUntil = Instant.MIN;
    private volatile Throwable failureCause;

    AssistantOrchestrator(AssistantOrchestratorBuilder b) {
        this.components = Objects.requireNonNull(b.components, "components");
        this.registry = components.toRegistry();
        this.integrityVerifier = Objects.requireNonNull(b.integrityVerifier, "integrityVerifier");
        this.healthMonitor = Objects.requireNonNull(b.healthMonitor, "healthMonitor");
        this.recoveryManager = Objects.requireNonNull(b.recoveryManager, "recoveryManager");
        this.coordinator = Objects.requireNonNull(b.coordinator, "coordinator");
        this.dispatcher = Objects.requireNonNull(b.dispatcher, "dispatcher");
        this.guard = Objects.requireNonNull(b.guard, "guard");
        this.scheduler = Objects.requireNonNull(b.scheduler, "scheduler");
        this.workerExecutor = Objects.requireNonNull(b.workerExecutor, "workerExecutor");
        this.ownedPools = List.copyOf(b.ownedPools);
        this.conversationProperties = Objects.requireNonNull(b.conversationProperties, "conversationProperties");
        HealthProperties health = Objects.requireNonNull(b.healthProperties, "healthProperties");
        RecoveryProperties recovery = Objects.requireNonNull(b.recoveryProperties, "recoveryProperties");
        this.healthCheckInterval = health.getCheckInterval();
        this.startTimeout = recovery.getRestartTimeout();
        this.clock = Objects.requireNonNull(b.clock, "clock");
        this.committedHealth = new AtomicReference<>(HealthReport.empty(clock.instant()));
    }

    /**
     * Runs the startup sequence.
     *
     * @throws IntegrityCheckException if integrity verification fails
     * @throws RecoveryFailedException  if unhealthy components could not be recovered
     * @throws IllegalStateException    if already started
     */
    public void start() {
        if (!status.compareAndSet(OrchestratorStatus.CREATED, OrchestratorStatus.STARTING)) {
            throw new IllegalStateException("Orchestrator already started (status=" + status.get() + ")");
        }
        LOG.info("Starting assistant orchestrator");
        try {
            verifyIntegrity();
            startComponents();
            subscribe();

            HealthReport report = healthMonitor.checkAll();
            commit(report);
            if (!report.isHealthy()) {
                recoverOrFail(report.unhealthyComponents());
            }

            setSystemStatus("active");
            nextHealthCheck = clock.instant().plus(healthCheckInterval);
            status.set(OrchestratorStatus.ACTIVE);
            coordinator.start();
            tickFuture = scheduler.scheduleWithFixedDelay(this::tick, conversationProperties.getTickInterval());
            LOG.info("Assistant orchestrator active ({} components)", registry.inStartOrder().size());
        } catch (RuntimeException e) {
            LOG.error("Startup aborted: {}", e.getMessage());
            emergencyShutdown(e);
            throw e;
        }
    }

    /**
     * One steady-state loop iteration. Runs on the scheduler; safe to call directly.
     */
    public void tick() {
        if (status.get() != OrchestratorStatus.ACTIVE) {
            return;
        }
        Instant now = clock.instant();
        if (now.isBefore(backoffUntil)) {
            return;
        }
        try {
            refreshVehicleState();
            if (coordinator.getState() == ConversationState.IDLE
                    && guard.call(ComponentNames.SPEECH_RECOGNITION, components.speechInput()::isWakeWordDetected)) {
                LOG.info("Wake word detected");
                coordinator.onWakeWord();
            }
            coordinator.checkListeningTimeout();
            if (!pendingRecovery.isEmpty()) {
                recoverReported();
            }
            if (!now.isBefore(nextHealthCheck)) {
                nextHealthCheck = now.plus(healthCheckInterval);
                runPeriodicHealthCheck();
            }
        } catch (RuntimeException e) {
            handleLoopError(e);
        }
    }

    /**
     * Orderly shutdown. Idempotent.
     */
    public void shutdown() {
        shutdown(false);
    }

    /**
     * Shutdown after a fatal error. Idempotent; a no-op if a shutdown already ran.
     */
    public void emergencyShutdown(Throwable cause) {
        if (!shutdownStarted.get()) {
            failureCause = cause;
            LOG.error("EMERGENCY SHUTDOWN: {}", cause == null ? "unknown cause" : cause.toString());
        }
        shutdown(true);
    }

    private void shutdown(boolean emergency) {
        if (!shutdownStarted.compareAndSet(false, true)) {
            return;
        }
        status.set(OrchestratorStatus.STOPPING);
        LOG.info("Shutting down assistant orchestrator (emergency={})", emergency);

        ScheduledFuture<?> tick = tickFuture;
        if (tick != null) {
            tick.cancel(false);
        }
        coordinator.stop();

        for (ManagedComponent component : registry.inStopOrder()) {
            try {
                component.stop();
                LOG.debug("Stopped component {}", component.name());
            } catch (RuntimeException e) {
                LOG.warn("Error stopping component {}: {}", component.name(), e.toString());
            }
        }
        try {
            integrityVerifier.stop();
        } catch (RuntimeException e) {
            LOG.warn("Error stopping integrity verifier: {}", e.toString());
        }
        for (ThreadPoolTaskExecutor pool : ownedPools) {
            // Non-blocking: this may run on one of the pool's own threads
            pool.getThreadPoolExecutor().shutdown();
        }

        status.set(emergency ? OrchestratorStatus.FAILED : OrchestratorStatus.STOPPED);
        LOG.info("Assistant orchestrator {}", emergency ? "stopped after emergency" : "stopped");
    }

    /**
     * Marks a failed component DEGRADED and schedules its recovery on the next tick.
     * Failures reported by recovery itself are recorded as FAILED and not retried.
     */
    @EventListener
    public void onComponentFailure(ComponentFailureEvent event) {
        if (registry.find(event.component()).isEmpty()) {
            LOG.warn("Failure reported for unknown component {}", event.component());
            return;
        }
        ComponentStatus newStatus = event.fromRecovery() ? ComponentStatus.FAILED : ComponentStatus.DEGRADED;
        committedHealth.updateAndGet(r -> r.with(new ComponentHealth(event.component(), newStatus,
                event.at(), String.valueOf(event.message()))));
        if (!event.fromRecovery() && status.get() == OrchestratorStatus.ACTIVE) {
            pendingRecovery.add(event.component());
        }
    }

    @EventListener
    public void onComponentRecovered(ComponentRecoveredEvent event) {
        if (registry.find(event.component()).isPresent()) {
            committedHealth.updateAndGet(r -> r.with(ComponentHealth.healthy(event.component(), event.at())));
        }
    }

    public OrchestratorStatus getStatus() {
        return status.get();
    }

    public boolean isActive() {
        return status.get() == OrchestratorStatus.ACTIVE;
    }

    public HealthReport getCommittedHealth() {
        return committedHealth.get();
    }

    public ConversationState getConversationState() {
        return coordinator.getState();
    }

    /**
     * The fatal error behind a FAILED status, or {@code null}.
     */
    public Throwable getFailureCause() {
        return failureCause;
    }

    private void verifyIntegrity() {
        integrityVerifier.start();
        if (!integrityVerifier.verifySystemIntegrity()) {
            throw new IntegrityCheckException("System integrity verification failed");
        }
        LOG.info("System integrity verified");
    }

    /**
     * Starts all components concurrently. Start failures are logged; the following health
     * check reports those components as failed.
     */
    private void startComponents() {
        Map<String, CompletableFuture<Void>> starts = new LinkedHashMap<>();
        for (ManagedComponent component : registry.inStartOrder()) {
            starts.put(component.name(), CompletableFuture.runAsync(component::start, workerExecutor));
        }
        long deadline = System.nanoTime() + startTimeout.toNanos();
        List<String> failed = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<Void>> entry : starts.entrySet()) {
            try {
                entry.getValue().get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                entry.getValue().cancel(true);
                failed.add(entry.getKey());
                LOG.error("Component {} did not start within {}ms", entry.getKey(), startTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CabinAssistException("Interrupted while starting components", e);
            } catch (ExecutionException e) {
                failed.add(entry.getKey());
                LOG.error("Component {} failed to start: {}", entry.getKey(), String.valueOf(e.getCause()));
            }
        }
        if (failed.isEmpty()) {
            LOG.info("All components started");
        } else {
            LOG.warn("Components failed to start: {}", failed);
        }
    }

    private void subscribe() {
        components.vehicle().subscribeToEvents(dispatcher);
        components.speechInput().setTranscriptionListener(coordinator);
        coordinator.setFatalErrorHandler(this::emergencyShutdown);
    }

    /**
     * Polls the vehicle into the context. The status is re-asserted with it so that a context
     * reset by its TTL reports the running system again on the next tick.
     */
    private void refreshVehicleState() {
        Map<String, Object> state = guard.call(ComponentNames.VEHICLE_INTEGRATION,
                components.vehicle()::getCurrentState);
        components.contextStore().update(Map.of(
                ConversationContext.VEHICLE_STATE, state,
                ConversationContext.SYSTEM_STATUS, Map.of("status", "active")));
    }

    private void recoverReported() {
        List<String> names = new ArrayList<>(pendingRecovery);
        pendingRecovery.removeAll(names);
        LOG.warn("Recovering components reported as failed: {}", names);
        recoverOrFail(names);
    }

    private void runPeriodicHealthCheck() {
        HealthReport report = healthMonitor.checkAll();
        commit(report);
        if (!report.isHealthy()) {
            recoverOrFail(report.unhealthyComponents());
        }
    }

    /**
     * @throws RecoveryFailedException if any component stays unhealthy
     */
    private void recoverOrFail(List<String> unhealthy) {
        RecoveryResult result = recoveryManager.recover(unhealthy);
        commit(new HealthReport(result.outcomes(), clock.instant()));
        if (!result.fullyRecovered()) {
            throw new RecoveryFailedException(result.failedComponents());
        }
    }

    private void commit(HealthReport report) {
        committedHealth.updateAndGet(current -> current.merge(report));
    }

    private void handleLoopError(RuntimeException e) {
        ErrorSeverity severity = ErrorPolicy.classify(e);
        if (severity == ErrorSeverity.FATAL) {
            emergencyShutdown(e);
            return;
        }
        if (e instanceof ComponentFailureException cfe) {
            LOG.warn("Loop iteration failed on {}: {}", cfe.getComponentName(), cfe.getMessage());
        } else {
            LOG.error("Error in main loop ({}): {}", severity, e.toString());
        }
        backoffUntil = clock.instant().plus(conversationProperties.getErrorBackoff());
    }

    private void setSystemStatus(String value) {
        components.contextStore().update(Map.of(ConversationContext.SYSTEM_STATUS, Map.of("status", value)));
    }
}
