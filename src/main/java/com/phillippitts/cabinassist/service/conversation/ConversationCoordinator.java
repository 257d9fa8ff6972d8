package com.phillippitts.cabinassist.service.conversation;

import com.phillippitts.cabinassist.config.properties.ConversationProperties;
import com.phillippitts.cabinassist.domain.ConversationContext;
import com.phillippitts.cabinassist.domain.ConversationTurn;
import com.phillippitts.cabinassist.domain.DialogueResponse;
import com.phillippitts.cabinassist.domain.NluResult;
import com.phillippitts.cabinassist.domain.PendingCommand;
import com.phillippitts.cabinassist.domain.ProactiveNotification;
import com.phillippitts.cabinassist.domain.Speaker;
import com.phillippitts.cabinassist.service.context.ContextStore;
import com.phillippitts.cabinassist.service.conversation.ConversationTrigger.ListeningTimedOut;
import com.phillippitts.cabinassist.service.conversation.ConversationTrigger.ProactiveTriggered;
import com.phillippitts.cabinassist.service.conversation.ConversationTrigger.ResponseDelivered;
import com.phillippitts.cabinassist.service.conversation.ConversationTrigger.ResponseGenerated;
import com.phillippitts.cabinassist.service.conversation.ConversationTrigger.TranscriptionReceived;
import com.phillippitts.cabinassist.service.conversation.ConversationTrigger.TurnFailed;
import com.phillippitts.cabinassist.service.conversation.ConversationTrigger.WakeWordDetected;
import com.phillippitts.cabinassist.service.lifecycle.AssistantComponents;
import com.phillippitts.cabinassist.service.lifecycle.ComponentNames;
import com.phillippitts.cabinassist.service.lifecycle.ProviderCallGuard;
import com.phillippitts.cabinassist.service.metrics.AssistantMetricsPublisher;
import com.phillippitts.cabinassist.service.orchestration.ErrorPolicy;
import com.phillippitts.cabinassist.service.orchestration.ErrorSeverity;
import com.phillippitts.cabinassist.service.speech.TranscriptionListener;
import com.phillippitts.cabinassist.service.vehicle.CommandResult;
import com.phillippitts.cabinassist.service.vehicle.UiState;
import com.phillippitts.cabinassist.service.vehicle.VehicleCommandExecutor;
import com.phillippitts.cabinassist.util.LogSanitizer;
import com.phillippitts.cabinassist.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Drives conversations: turns wake words, transcriptions and proactive notifications into
 * state transitions and performs their side effects.
 *
 * <p><b>Threading model:</b> producers (speech callbacks, the orchestrator tick, the event
 * dispatcher, REST calls) only enqueue {@link ConversationTrigger}s. A single consumer takes them
 * in FIFO order and handles each to completion before taking the next, so a trigger that arrives
 * while a turn is in flight is evaluated against the state the turn left behind.
 *
 * <p><b>Turn pipeline</b> (LISTENING to PROCESSING):
 * <ol>
 *   <li>UI to processing, language understanding (bounded by the provider timeout)</li>
 *   <li>User turn appended, current intent and entities merged into the context</li>
 *   <li>Dialogue response generated; the machine moves to SPEAKING</li>
 *   <li>Attached vehicle commands executed, vehicle state refreshed into the context</li>
 *   <li>Response spoken and appended; UI back to listening, or idle when the conversation ends</li>
 * </ol>
 *
 * <p><b>Error handling:</b> transient and validation errors during a turn are logged, answered with
 * a spoken apology and return the conversation to LISTENING. Fatal errors reset the machine and
 * are handed to the fatal error handler (the orchestrator's emergency shutdown).
 *
 * <p>Proactive notifications are queued like any other trigger. One that reaches the consumer
 * while a session exists is deferred and delivered, in arrival order, once the machine is back
 * in IDLE.
 */
public class ConversationCoordinator implements TranscriptionListener {

    private static final Logger LOG = LogManager.getLogger(ConversationCoordinator.class);

    public static final String MDC_SESSION_ID = "sessionId";

    private final ConversationStateMachine stateMachine;
    private final AssistantComponents components;
    private final ContextStore context;
    private final VehicleCommandExecutor commands;
    private final ProviderCallGuard guard;
    private final ConversationProperties properties;
    private final AssistantMetricsPublisher metrics;
    private final Clock clock;
    private final Executor consumerExecutor;

    private final BlockingQueue<ConversationTrigger> triggers = new LinkedBlockingQueue<>();
    private final Queue<ProactiveNotification> deferred = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean timeoutQueued = new AtomicBoolean(false);

    private volatile Instant lastActivity;
    private volatile Thread consumerThread;
    private volatile CountDownLatch consumerDone = new CountDownLatch(0);
    private volatile Consumer<Throwable> fatalErrorHandler =
            e -> LOG.error("Fatal conversation error with no handler installed", e);

    public ConversationCoordinator(ConversationStateMachine stateMachine,
                                   AssistantComponents components,
                                   VehicleCommandExecutor commands,
                                   ProviderCallGuard guard,
                                   ConversationProperties properties,
                                   AssistantMetricsPublisher metrics,
                                   Clock clock,
                                   Executor consumerExecutor) {
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.components = Objects.requireNonNull(components, "components");
        this.context = components.contextStore();
        this.commands = Objects.requireNonNull(commands, "commands");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.metrics = metrics == null ? AssistantMetricsPublisher.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.consumerExecutor = Objects.requireNonNull(consumerExecutor, "consumerExecutor");
        this.lastActivity = clock.instant();
    }

    /**
     * Installs the handler invoked with fatal errors raised while handling a trigger.
     */
    public void setFatalErrorHandler(Consumer<Throwable> handler) {
        this.fatalErrorHandler = Objects.requireNonNull(handler, "handler");
    }

    /**
     * Starts the single trigger consumer. Idempotent.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        consumerDone = new CountDownLatch(1);
        consumerExecutor.execute(this::consumeLoop);
        LOG.info("Conversation consumer started");
    }

    /**
     * Stops the consumer, drops queued triggers and returns the machine to IDLE. Idempotent.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        if (Thread.currentThread() != consumerThread) {
            try {
                if (!consumerDone.await(properties.getErrorBackoff().toMillis()
                        + properties.getTickInterval().toMillis() * 2, TimeUnit.MILLISECONDS)) {
                    LOG.warn("Conversation consumer did not stop in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        triggers.clear();
        ConversationSession discarded = stateMachine.reset();
        if (discarded != null) {
            LOG.info("Conversation {} discarded on stop", discarded.id());
        }
        ThreadContext.remove(MDC_SESSION_ID);
        LOG.info("Conversation consumer stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Queues a trigger for the consumer.
     */
    public void submit(ConversationTrigger trigger) {
        triggers.add(Objects.requireNonNull(trigger, "trigger"));
    }

    public void onWakeWord() {
        submit(new WakeWordDetected());
    }

    @Override
    public void onTranscription(String transcription, double confidence) {
        submit(new TranscriptionReceived(transcription, confidence));
    }

    /**
     * Queues a proactive notification. The consumer delivers it when the machine is IDLE and
     * otherwise defers it until the conversation ends.
     */
    public void offerProactive(ProactiveNotification notification) {
        submit(new ProactiveTriggered(Objects.requireNonNull(notification, "notification")));
    }

    /**
     * Queues a listening timeout when LISTENING has seen no activity for the configured period.
     */
    public void checkListeningTimeout() {
        if (stateMachine.getState() == ConversationState.LISTENING
                && listeningExpired()
                && timeoutQueued.compareAndSet(false, true)) {
            submit(new ListeningTimedOut());
        }
    }

    public ConversationState getState() {
        return stateMachine.getState();
    }

    public boolean isConversationActive() {
        return stateMachine.isBusy();
    }

    public int deferredCount() {
        return deferred.size();
    }

    /**
     * Handles every queued trigger on the calling thread. Meant for callers that run without
     * the consumer thread, such as tests.
     *
     * @return number of triggers handled
     */
    public int processPending() {
        int handled = 0;
        ConversationTrigger trigger;
        while ((trigger = triggers.poll()) != null) {
            process(trigger);
            handled++;
        }
        return handled;
    }

    private void consumeLoop() {
        consumerThread = Thread.currentThread();
        try {
            while (running.get()) {
                ConversationTrigger trigger = triggers.poll(properties.getTickInterval().toMillis(), TimeUnit.MILLISECONDS);
                if (trigger != null) {
                    process(trigger);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Conversation consumer interrupted");
        } finally {
            ThreadContext.remove(MDC_SESSION_ID);
            consumerThread = null;
            consumerDone.countDown();
        }
    }

    private void process(ConversationTrigger trigger) {
        try {
            handle(trigger);
        } catch (RuntimeException | Error e) {
            if (ErrorPolicy.isFatal(e)) {
                LOG.error("Fatal error while handling {}: {}", trigger.getClass().getSimpleName(), e.toString());
                stateMachine.reset();
                ThreadContext.remove(MDC_SESSION_ID);
                fatalErrorHandler.accept(e);
                return;
            }
            LOG.error("Error while handling {}: {}", trigger.getClass().getSimpleName(), e.toString());
            backOff();
        }
    }

    private void handle(ConversationTrigger trigger) {
        if (trigger instanceof WakeWordDetected wake) {
            onWake(wake);
        } else if (trigger instanceof TranscriptionReceived transcription) {
            onTranscriptionReceived(transcription);
        } else if (trigger instanceof ProactiveTriggered proactive) {
            onProactive(proactive);
        } else if (trigger instanceof ListeningTimedOut timeout) {
            onListeningTimeout(timeout);
        } else {
            TransitionResult result = fire(trigger);
            LOG.debug("External {} evaluated: {} -> {}", trigger.getClass().getSimpleName(), result.from(), result.to());
        }
    }

    private void onWake(WakeWordDetected wake) {
        TransitionResult result = fire(wake);
        if (!result.accepted()) {
            LOG.debug("Wake word ignored in state {}", result.from());
            return;
        }
        ThreadContext.put(MDC_SESSION_ID, result.session().id().toString());
        LOG.info("Conversation started");
        touch();
        setUi(UiState.LISTENING);
        speak(properties.getAcknowledgement());
        logEvent("conversation_started", Map.of("session_id", result.session().id().toString()));
    }

    private void onTranscriptionReceived(TranscriptionReceived transcription) {
        TransitionResult result = fire(transcription);
        if (!result.accepted()) {
            LOG.debug("Transcription ignored in state {}", result.from());
            return;
        }
        touch();
        if (!result.changed()) {
            metrics.recordLowConfidence();
            LOG.info("Low-confidence transcription ({} < {}); asking to repeat",
                    transcription.confidence(), properties.getMinConfidence());
            speak(properties.getClarificationPrompt());
            return;
        }
        runTurn(transcription.text(), result.session());
    }

    private void runTurn(String text, ConversationSession session) {
        long start = System.nanoTime();
        String outcome = "ok";
        LOG.info("Turn {} started: \"{}\"", session.turnCount(), LogSanitizer.preview(text));
        try {
            setUi(UiState.PROCESSING);
            NluResult nlu = guard.call(ComponentNames.NLU, () -> components.understanding().process(text));
            context.appendTurn(ConversationTurn.user(clock.instant(), text, nlu.intent(), nlu.entities()));
            Map<String, Object> update = new LinkedHashMap<>();
            update.put(ConversationContext.CURRENT_INTENT, nlu.intent());
            update.put(ConversationContext.ENTITIES, nlu.entities());
            context.update(update);

            ConversationContext snapshot = context.read();
            DialogueResponse response = guard.call(ComponentNames.DIALOGUE_MANAGER,
                    () -> components.dialogue().processTurn(nlu, snapshot));
            fire(new ResponseGenerated());

            executeCommands(response.commands());
            if (!response.uiUpdate().isEmpty()) {
                guard.run(ComponentNames.VEHICLE_INTEGRATION, () -> components.vehicle().updateUi(response.uiUpdate()));
            }
            deliver(response.speechResponse(), Speaker.ASSISTANT, Map.of());
            logInteraction(text, nlu, response);

            TransitionResult done = fire(new ResponseDelivered(response.endConversation()));
            afterDelivery(done);
        } catch (RuntimeException e) {
            outcome = "error";
            onTurnError(e);
        } finally {
            metrics.recordTurn(System.nanoTime() - start, outcome);
        }
    }

    private void onTurnError(RuntimeException e) {
        ErrorSeverity severity = ErrorPolicy.classify(e);
        if (severity == ErrorSeverity.FATAL) {
            throw e;
        }
        if (severity == ErrorSeverity.VALIDATION) {
            LOG.warn("Turn rejected: {}", e.getMessage());
        } else {
            LOG.error("Error processing speech input: {}", e.getMessage());
        }
        logEvent("turn_error", Map.of("severity", severity.name(), "error", e.getClass().getSimpleName()));
        try {
            speak(properties.getApology());
        } catch (RuntimeException speakFailure) {
            LOG.warn("Could not speak apology: {}", speakFailure.getMessage());
        }
        TransitionResult result = fire(new TurnFailed(e));
        if (result.accepted()) {
            afterDelivery(result);
        }
    }

    private void onProactive(ProactiveTriggered trigger) {
        ProactiveNotification notification = trigger.notification();
        TransitionResult result = fire(trigger);
        if (!result.accepted()) {
            // Only the consumer touches the deferred queue, so a flush cannot miss it
            deferred.add(notification);
            if (!trigger.redelivery()) {
                metrics.recordProactive(notification.eventType(), true);
            }
            LOG.info("Deferred proactive notification event={} (state {})", notification.eventType(), result.from());
            return;
        }
        if (!trigger.redelivery()) {
            metrics.recordProactive(notification.eventType(), false);
        }
        ThreadContext.put(MDC_SESSION_ID, result.session().id().toString());
        LOG.info("Delivering proactive notification event={}", notification.eventType());
        TransitionResult done;
        try {
            executeCommands(notification.commands());
            deliver(notification.speech(), Speaker.SYSTEM, Map.of("event", notification.eventType()));
            logEvent("proactive_notification", Map.of("event_type", notification.eventType()));
            done = fire(new ResponseDelivered(true));
        } catch (RuntimeException e) {
            if (ErrorPolicy.isFatal(e)) {
                throw e;
            }
            LOG.error("Proactive notification event={} failed: {}", notification.eventType(), e.getMessage());
            done = fire(new TurnFailed(e));
        }
        afterDelivery(done);
    }

    private void onListeningTimeout(ListeningTimedOut timeout) {
        timeoutQueued.set(false);
        if (!listeningExpired()) {
            LOG.debug("Stale listening timeout ignored");
            return;
        }
        TransitionResult result = fire(timeout);
        if (result.accepted()) {
            LOG.info("No utterance for {}ms; ending conversation", properties.getListeningTimeout().toMillis());
            afterDelivery(result);
        }
    }

    private void afterDelivery(TransitionResult result) {
        if (result.to() == ConversationState.IDLE) {
            endConversation(result.session());
        } else if (result.to() == ConversationState.LISTENING) {
            touch();
            setUi(UiState.LISTENING);
        }
    }

    private void endConversation(ConversationSession session) {
        try {
            setUi(UiState.IDLE);
        } catch (RuntimeException e) {
            LOG.warn("Could not reset UI to idle: {}", e.getMessage());
        }
        Duration duration = TimeUtils.elapsedBetween(session.startedAt(), clock.instant());
        if (session.active()) {
            LOG.info("Conversation ended after {} turn(s), duration={}ms", session.turnCount(), duration.toMillis());
            logEvent("conversation_ended", Map.of(
                    "session_id", session.id().toString(),
                    "turns", session.turnCount(),
                    "duration_ms", duration.toMillis()));
        }
        ThreadContext.remove(MDC_SESSION_ID);
        flushDeferred();
    }

    private void flushDeferred() {
        ProactiveNotification next;
        while ((next = deferred.poll()) != null) {
            submit(new ProactiveTriggered(next, true));
        }
    }

    private void executeCommands(List<PendingCommand> pending) {
        if (pending.isEmpty()) {
            return;
        }
        commands.enqueueAll(pending);
        List<CommandResult> results = commands.drain();
        long failed = results.stream().filter(r -> !r.success()).count();
        LOG.info("Executed {} vehicle command(s), {} failed", results.size(), failed);
        refreshVehicleState();
    }

    private void refreshVehicleState() {
        Map<String, Object> state = guard.call(ComponentNames.VEHICLE_INTEGRATION,
                () -> components.vehicle().getCurrentState());
        context.updateVehicleState(state);
    }

    private void deliver(String text, Speaker speaker, Map<String, Object> entities) {
        setUi(UiState.SPEAKING);
        if (!text.isBlank()) {
            speak(text);
        }
        context.appendTurn(new ConversationTurn(clock.instant(), speaker, text, null, entities));
    }

    private void speak(String text) {
        guard.run(ComponentNames.TTS, () -> components.speechOutput().speak(text, false));
    }

    private void setUi(UiState state) {
        guard.run(ComponentNames.VEHICLE_INTEGRATION, () -> components.vehicle().setUiState(state));
    }

    private TransitionResult fire(ConversationTrigger trigger) {
        TransitionResult result = stateMachine.fire(trigger);
        if (result.changed()) {
            metrics.recordTransition(result.from().name(), result.to().name());
            LOG.debug("Conversation {} -> {}", result.from(), result.to());
        }
        return result;
    }

    private void logEvent(String name, Map<String, Object> payload) {
        try {
            components.telemetry().logEvent(name, payload);
        } catch (RuntimeException e) {
            LOG.warn("Telemetry event {} dropped: {}", name, e.getMessage());
        }
    }

    private void logInteraction(String text, NluResult nlu, DialogueResponse response) {
        try {
            components.telemetry().logInteraction(text, nlu, response);
        } catch (RuntimeException e) {
            LOG.warn("Telemetry interaction dropped: {}", e.getMessage());
        }
    }

    private void touch() {
        lastActivity = clock.instant();
    }

    private boolean listeningExpired() {
        return TimeUtils.elapsedBetween(lastActivity, clock.instant()).compareTo(properties.getListeningTimeout()) > 0;
    }

    private void backOff() {
        try {
            Thread.sleep(properties.getErrorBackoff().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
