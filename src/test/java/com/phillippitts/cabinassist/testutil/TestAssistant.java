package com.phillippitts.cabinassist.testutil;

import com.phillippitts.cabinassist.config.properties.ContextProperties;
import com.phillippitts.cabinassist.config.properties.ConversationProperties;
import com.phillippitts.cabinassist.config.properties.HealthProperties;
import com.phillippitts.cabinassist.config.properties.IntegrityProperties;
import com.phillippitts.cabinassist.config.properties.RecoveryProperties;
import com.phillippitts.cabinassist.service.context.ContextStore;
import com.phillippitts.cabinassist.service.context.InMemoryContextStore;
import com.phillippitts.cabinassist.service.conversation.ConversationCoordinator;
import com.phillippitts.cabinassist.service.conversation.ConversationStateMachine;
import com.phillippitts.cabinassist.service.dialogue.DialogueEngine;
import com.phillippitts.cabinassist.service.dialogue.TemplateDialogueEngine;
import com.phillippitts.cabinassist.service.dispatch.VehicleEventDispatcher;
import com.phillippitts.cabinassist.service.health.ComponentHealthMonitor;
import com.phillippitts.cabinassist.service.lifecycle.AssistantComponents;
import com.phillippitts.cabinassist.service.lifecycle.ProviderCallGuard;
import com.phillippitts.cabinassist.service.metrics.AssistantMetricsPublisher;
import com.phillippitts.cabinassist.service.nlu.KeywordLanguageUnderstanding;
import com.phillippitts.cabinassist.service.nlu.LanguageUnderstanding;
import com.phillippitts.cabinassist.service.orchestration.AssistantOrchestrator;
import com.phillippitts.cabinassist.service.orchestration.AssistantOrchestratorBuilder;
import com.phillippitts.cabinassist.service.recovery.RecoveryManager;
import com.phillippitts.cabinassist.service.security.DigestIntegrityVerifier;
import com.phillippitts.cabinassist.service.security.IntegrityVerifier;
import com.phillippitts.cabinassist.service.speech.QueuedSpeechInput;
import com.phillippitts.cabinassist.service.speech.SpeechInput;
import com.phillippitts.cabinassist.service.speech.SpeechOutput;
import com.phillippitts.cabinassist.service.telemetry.Telemetry;
import com.phillippitts.cabinassist.service.vehicle.VehicleCommandExecutor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executor;

import static org.mockito.Mockito.mock;

/**
 * Fully wired assistant for scenario tests, running deterministically on the test thread.
 *
 * <p>Every pool is a {@link SyncExecutor}; the conversation consumer never runs on its own, so
 * tests drive it with {@link ConversationCoordinator#processPending()}. The scheduler is a Mockito
 * mock and the tick is invoked by hand. Time comes from a {@link MutableClock}.
 *
 * <p>Collaborator fields may be replaced before {@link #build()}; wired objects are available
 * after it.
 */
public class TestAssistant {

    public final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T08:00:00Z"));
    public final EventCapturingPublisher publisher = new EventCapturingPublisher();
    public final ContextProperties contextProperties = new ContextProperties();
    public final ConversationProperties conversationProperties = new ConversationProperties();
    public final HealthProperties healthProperties = new HealthProperties();
    public final RecoveryProperties recoveryProperties = new RecoveryProperties();
    public final TaskScheduler scheduler = mock(TaskScheduler.class);

    public SpeechInput speechInput = new QueuedSpeechInput();
    public LanguageUnderstanding understanding = new KeywordLanguageUnderstanding();
    public DialogueEngine dialogue = new TemplateDialogueEngine();
    public SpeechOutput speechOutput = new RecordingSpeechOutput();
    public RecordingVehicleLink vehicle = new RecordingVehicleLink();
    public ContextStore contextStore;
    public Telemetry telemetry = new RecordingTelemetry();
    public IntegrityVerifier integrityVerifier = new DigestIntegrityVerifier(new IntegrityProperties());
    public Executor workerExecutor = new SyncExecutor();
    public AssistantMetricsPublisher metrics = AssistantMetricsPublisher.NOOP;

    public ConversationStateMachine stateMachine;
    public ConversationCoordinator coordinator;
    public VehicleEventDispatcher dispatcher;
    public VehicleCommandExecutor commandExecutor;
    public ComponentHealthMonitor healthMonitor;
    public RecoveryManager recoveryManager;
    public AssistantComponents components;
    public AssistantOrchestrator orchestrator;

    public TestAssistant() {
        // Keep stop() from waiting on a consumer that never ran
        conversationProperties.setErrorBackoff(Duration.ofMillis(5));
        conversationProperties.setTickInterval(Duration.ofMillis(5));
    }

    public AssistantOrchestrator build() {
        if (contextStore == null) {
            contextStore = new InMemoryContextStore(contextProperties, clock);
        }
        ProviderCallGuard guard = new ProviderCallGuard(workerExecutor, Duration.ofSeconds(2), publisher, clock);
        components = new AssistantComponents(speechInput, understanding, dialogue, speechOutput,
                vehicle, contextStore, telemetry);
        stateMachine = new ConversationStateMachine(conversationProperties.getMinConfidence(),
                conversationProperties.getMaxTurns(), clock);
        commandExecutor = new VehicleCommandExecutor(vehicle, guard, AssistantMetricsPublisher.NOOP);
        coordinator = new ConversationCoordinator(stateMachine, components, commandExecutor, guard,
                conversationProperties, metrics, clock, command -> { });
        dispatcher = new VehicleEventDispatcher(contextStore, dialogue, coordinator, telemetry, guard,
                new SyncExecutor());
        healthMonitor = new ComponentHealthMonitor(components.toRegistry(), workerExecutor, healthProperties, clock);
        recoveryManager = new RecoveryManager(components.toRegistry(), healthMonitor, workerExecutor,
                recoveryProperties, publisher, AssistantMetricsPublisher.NOOP, clock);
        orchestrator = AssistantOrchestratorBuilder.builder()
                .components(components)
                .integrityVerifier(integrityVerifier)
                .healthMonitor(healthMonitor)
                .recoveryManager(recoveryManager)
                .coordinator(coordinator)
                .dispatcher(dispatcher)
                .guard(guard)
                .scheduler(scheduler)
                .workerExecutor(workerExecutor)
                .conversationProperties(conversationProperties)
                .healthProperties(healthProperties)
                .recoveryProperties(recoveryProperties)
                .clock(clock)
                .build();
        return orchestrator;
    }

    public QueuedSpeechInput queuedSpeechInput() {
        return (QueuedSpeechInput) speechInput;
    }

    public RecordingSpeechOutput recordingSpeechOutput() {
        return (RecordingSpeechOutput) speechOutput;
    }

    public RecordingTelemetry recordingTelemetry() {
        return (RecordingTelemetry) telemetry;
    }
}
