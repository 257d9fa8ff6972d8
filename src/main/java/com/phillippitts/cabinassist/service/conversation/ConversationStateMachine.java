package com.phillippitts.cabinassist.service.conversation;

import com.phillippitts.cabinassist.service.conversation.ConversationTrigger.ListeningTimedOut;
import com.phillippitts.cabinassist.service.conversation.ConversationTrigger.ProactiveTriggered;
import com.phillippitts.cabinassist.service.conversation.ConversationTrigger.ResponseDelivered;
import com.phillippitts.cabinassist.service.conversation.ConversationTrigger.ResponseGenerated;
import com.phillippitts.cabinassist.service.conversation.ConversationTrigger.TranscriptionReceived;
import com.phillippitts.cabinassist.service.conversation.ConversationTrigger.TurnFailed;
import com.phillippitts.cabinassist.service.conversation.ConversationTrigger.WakeWordDetected;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe conversation state machine. Holds no side effects; the coordinator acts on the
 * returned {@link TransitionResult}.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE       + wake word                      → LISTENING
 * IDLE       + proactive notification         → SPEAKING
 * LISTENING  + transcription, conf ≥ minimum  → PROCESSING (turn counted)
 * LISTENING  + transcription, conf &lt; minimum  → LISTENING
 * LISTENING  + listening timeout              → IDLE
 * PROCESSING + response generated             → SPEAKING
 * SPEAKING   + delivered, end or turn limit   → IDLE
 * SPEAKING   + delivered, otherwise           → LISTENING
 * PROCESSING
 *  or SPEAKING + turn failed                  → LISTENING (IDLE for a proactive session)
 * </pre>
 * Anything else is ignored, including a wake word outside IDLE and a proactive notification
 * while a session exists.
 *
 * <p><b>Thread Safety:</b> evaluation is guarded by a {@link ReentrantLock}; each trigger sees
 * the state left by the previous one.
 *
 * @since 1.0
 */
public final class ConversationStateMachine {

    private final Lock lock = new ReentrantLock();
    private final double minConfidence;
    private final int maxTurns;
    private final Clock clock;

    private ConversationState state = ConversationState.IDLE;
    private ConversationSession session;

    public ConversationStateMachine(double minConfidence, int maxTurns, Clock clock) {
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be between 0.0 and 1.0");
        }
        if (maxTurns <= 0) {
            throw new IllegalArgumentException("maxTurns must be positive");
        }
        this.minConfidence = minConfidence;
        this.maxTurns = maxTurns;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Evaluates one trigger against the current state.
     *
     * @throws NullPointerException if trigger is null
     */
    public TransitionResult fire(ConversationTrigger trigger) {
        Objects.requireNonNull(trigger, "trigger");
        lock.lock();
        try {
            ConversationState from = state;
            ConversationState to = next(from, trigger);
            if (to == null) {
                return TransitionResult.ignored(from, session);
            }
            if (trigger instanceof WakeWordDetected) {
                session = ConversationSession.conversation(clock.instant());
            } else if (trigger instanceof ProactiveTriggered) {
                session = ConversationSession.proactive(clock.instant());
            } else if (to == ConversationState.PROCESSING) {
                session = session.withNextTurn();
            }
            ConversationSession involved = session.withState(to);
            state = to;
            session = to == ConversationState.IDLE ? null : involved;
            return new TransitionResult(from, to, true, involved);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the successor state, or {@code null} when the trigger is a no-op.
     */
    private ConversationState next(ConversationState from, ConversationTrigger trigger) {
        return switch (from) {
            case IDLE -> {
                if (trigger instanceof WakeWordDetected) {
                    yield ConversationState.LISTENING;
                }
                yield trigger instanceof ProactiveTriggered ? ConversationState.SPEAKING : null;
            }
            case LISTENING -> {
                if (trigger instanceof TranscriptionReceived t) {
                    yield t.confidence() >= minConfidence ? ConversationState.PROCESSING : ConversationState.LISTENING;
                }
                yield trigger instanceof ListeningTimedOut ? ConversationState.IDLE : null;
            }
            case PROCESSING -> {
                if (trigger instanceof ResponseGenerated) {
                    yield ConversationState.SPEAKING;
                }
                yield trigger instanceof TurnFailed ? afterFailure() : null;
            }
            case SPEAKING -> {
                if (trigger instanceof TurnFailed) {
                    yield afterFailure();
                }
                if (trigger instanceof ResponseDelivered d) {
                    boolean limitReached = session.active() && session.turnCount() >= maxTurns;
                    yield d.endConversation() || !session.active() || limitReached
                            ? ConversationState.IDLE
                            : ConversationState.LISTENING;
                }
                yield null;
            }
        };
    }

    private ConversationState afterFailure() {
        return session.active() ? ConversationState.LISTENING : ConversationState.IDLE;
    }

    public ConversationState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public Optional<ConversationSession> getSession() {
        lock.lock();
        try {
            return Optional.ofNullable(session);
        } finally {
            lock.unlock();
        }
    }

    /**
     * True while any session exists, user conversation or proactive notification.
     */
    public boolean isBusy() {
        lock.lock();
        try {
            return state != ConversationState.IDLE;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forces the machine back to IDLE, discarding the session. Used on shutdown and after
     * an unrecoverable turn error.
     *
     * @return the discarded session, or {@code null} if already idle
     */
    public ConversationSession reset() {
        lock.lock();
        try {
            ConversationSession discarded = session;
            state = ConversationState.IDLE;
            session = null;
            return discarded;
        } finally {
            lock.unlock();
        }
    }
}
