package com.phillippitts.cabinassist.config.orchestration;

import com.phillippitts.cabinassist.config.properties.ConversationProperties;
import com.phillippitts.cabinassist.config.properties.HealthProperties;
import com.phillippitts.cabinassist.config.properties.ProviderProperties;
import com.phillippitts.cabinassist.config.properties.RecoveryProperties;
import com.phillippitts.cabinassist.service.context.ContextStore;
import com.phillippitts.cabinassist.service.conversation.ConversationCoordinator;
import com.phillippitts.cabinassist.service.conversation.ConversationStateMachine;
import com.phillippitts.cabinassist.service.dialogue.DialogueEngine;
import com.phillippitts.cabinassist.service.dispatch.VehicleEventDispatcher;
import com.phillippitts.cabinassist.service.health.ComponentHealthMonitor;
import com.phillippitts.cabinassist.service.lifecycle.AssistantComponents;
import com.phillippitts.cabinassist.service.lifecycle.ComponentRegistry;
import com.phillippitts.cabinassist.service.lifecycle.ProviderCallGuard;
import com.phillippitts.cabinassist.service.metrics.AssistantMetrics;
import com.phillippitts.cabinassist.service.metrics.AssistantMetricsPublisher;
import com.phillippitts.cabinassist.service.nlu.LanguageUnderstanding;
import com.phillippitts.cabinassist.service.orchestration.AssistantLifecycle;
import com.phillippitts.cabinassist.service.orchestration.AssistantOrchestrator;
import com.phillippitts.cabinassist.service.orchestration.AssistantOrchestratorBuilder;
import com.phillippitts.cabinassist.service.recovery.RecoveryManager;
import com.phillippitts.cabinassist.service.security.IntegrityVerifier;
import com.phillippitts.cabinassist.service.speech.SpeechInput;
import com.phillippitts.cabinassist.service.speech.SpeechOutput;
import com.phillippitts.cabinassist.service.telemetry.Telemetry;
import com.phillippitts.cabinassist.service.vehicle.VehicleCommandExecutor;
import com.phillippitts.cabinassist.service.vehicle.VehicleLink;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Wires the assistant orchestrator and its engines explicitly.
 * Uses constructor injection to manage common dependencies across bean methods.
 */
@Configuration
public class OrchestrationConfig {

    // Shared across bean methods
    private final ThreadPoolTaskExecutor workerExecutor;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public OrchestrationConfig(@Qualifier("workerExecutor") ThreadPoolTaskExecutor workerExecutor,
                               ApplicationEventPublisher publisher,
                               Clock clock) {
        this.workerExecutor = workerExecutor;
        this.publisher = publisher;
        this.clock = clock;
    }

    @Bean
    public AssistantMetricsPublisher assistantMetricsPublisher(AssistantMetrics metrics) {
        return new AssistantMetricsPublisher(metrics);
    }

    /**
     * Timeout guard shared by every call into a collaborator.
     */
    @Bean
    public ProviderCallGuard providerCallGuard(ProviderProperties providerProperties) {
        return new ProviderCallGuard(workerExecutor, providerProperties.getCallTimeout(), publisher, clock);
    }

    @Bean
    public AssistantComponents assistantComponents(SpeechInput speechInput,
                                                   LanguageUnderstanding languageUnderstanding,
                                                   DialogueEngine dialogueEngine,
                                                   SpeechOutput speechOutput,
                                                   VehicleLink vehicleLink,
                                                   ContextStore contextStore,
                                                   Telemetry telemetry) {
        return new AssistantComponents(speechInput, languageUnderstanding, dialogueEngine, speechOutput,
                vehicleLink, contextStore, telemetry);
    }

    @Bean
    public ComponentHealthMonitor componentHealthMonitor(AssistantComponents components,
                                                         HealthProperties healthProperties) {
        ComponentRegistry registry = components.toRegistry();
        return new ComponentHealthMonitor(registry, workerExecutor, healthProperties, clock);
    }

    @Bean
    public RecoveryManager recoveryManager(AssistantComponents components,
                                           ComponentHealthMonitor healthMonitor,
                                           RecoveryProperties recoveryProperties,
                                           AssistantMetricsPublisher metricsPublisher) {
        return new RecoveryManager(components.toRegistry(), healthMonitor, workerExecutor,
                recoveryProperties, publisher, metricsPublisher, clock);
    }

    @Bean
    public ConversationStateMachine conversationStateMachine(ConversationProperties conversationProperties) {
        return new ConversationStateMachine(conversationProperties.getMinConfidence(),
                conversationProperties.getMaxTurns(), clock);
    }

    @Bean
    public VehicleCommandExecutor vehicleCommandExecutor(VehicleLink vehicleLink,
                                                         ProviderCallGuard guard,
                                                         AssistantMetricsPublisher metricsPublisher) {
        return new VehicleCommandExecutor(vehicleLink, guard, metricsPublisher);
    }

    @Bean
    public ConversationCoordinator conversationCoordinator(
            ConversationStateMachine stateMachine,
            AssistantComponents components,
            VehicleCommandExecutor commandExecutor,
            ProviderCallGuard guard,
            ConversationProperties conversationProperties,
            AssistantMetricsPublisher metricsPublisher,
            @Qualifier("conversationExecutor") ThreadPoolTaskExecutor conversationExecutor) {
        return new ConversationCoordinator(stateMachine, components, commandExecutor, guard,
                conversationProperties, metricsPublisher, clock, conversationExecutor);
    }

    @Bean
    public VehicleEventDispatcher vehicleEventDispatcher(
            AssistantComponents components,
            ConversationCoordinator coordinator,
            ProviderCallGuard guard,
            @Qualifier("eventExecutor") ThreadPoolTaskExecutor eventExecutor) {
        return new VehicleEventDispatcher(components.contextStore(), components.dialogue(), coordinator,
                components.telemetry(), guard, eventExecutor);
    }

    @Bean
    public AssistantOrchestrator assistantOrchestrator(
            AssistantComponents components,
            IntegrityVerifier integrityVerifier,
            ComponentHealthMonitor healthMonitor,
            RecoveryManager recoveryManager,
            ConversationCoordinator coordinator,
            VehicleEventDispatcher dispatcher,
            ProviderCallGuard guard,
            @Qualifier("assistantScheduler") ThreadPoolTaskScheduler scheduler,
            @Qualifier("eventExecutor") ThreadPoolTaskExecutor eventExecutor,
            @Qualifier("conversationExecutor") ThreadPoolTaskExecutor conversationExecutor,
            ConversationProperties conversationProperties,
            HealthProperties healthProperties,
            RecoveryProperties recoveryProperties) {
        return AssistantOrchestratorBuilder.builder()
                .components(components)
                .integrityVerifier(integrityVerifier)
                .healthMonitor(healthMonitor)
                .recoveryManager(recoveryManager)
                .coordinator(coordinator)
                .dispatcher(dispatcher)
                .guard(guard)
                .scheduler(scheduler)
                .workerExecutor(workerExecutor)
                .ownedPool(workerExecutor)
                .ownedPool(eventExecutor)
                .ownedPool(conversationExecutor)
                .conversationProperties(conversationProperties)
                .healthProperties(healthProperties)
                .recoveryProperties(recoveryProperties)
                .clock(clock)
                .build();
    }

    /**
     * Starts the orchestrator with the application context. Disable with
     * {@code assistant.auto-start=false} to drive it manually (tests, diagnostics).
     */
    @Bean
    public AssistantLifecycle assistantLifecycle(AssistantOrchestrator orchestrator,
                                                 @Value("${assistant.auto-start:true}") boolean autoStart) {
        return new AssistantLifecycle(orchestrator, autoStart);
    }
}
