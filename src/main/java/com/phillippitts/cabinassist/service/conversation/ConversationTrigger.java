package com.phillippitts.cabinassist.service.conversation;

import com.phillippitts.cabinassist.domain.ProactiveNotification;

import java.util.Objects;

/**
 * Inputs evaluated by the {@link ConversationStateMachine}.
 *
 * <p>External triggers (wake word, transcription, proactive notification, listening timeout) are
 * queued and consumed in FIFO order; response triggers are fired by the coordinator while it
 * handles a turn.
 */
public interface ConversationTrigger {

    record WakeWordDetected() implements ConversationTrigger {
    }

    record TranscriptionReceived(String text, double confidence) implements ConversationTrigger {
        public TranscriptionReceived {
            text = text == null ? "" : text;
        }
    }

    record ResponseGenerated() implements ConversationTrigger {
    }

    record ResponseDelivered(boolean endConversation) implements ConversationTrigger {
    }

    /**
     * @param redelivery true when the notification was deferred once and is now re-queued
     */
    record ProactiveTriggered(ProactiveNotification notification, boolean redelivery) implements ConversationTrigger {
        public ProactiveTriggered {
            Objects.requireNonNull(notification, "notification");
        }

        public ProactiveTriggered(ProactiveNotification notification) {
            this(notification, false);
        }
    }

    record ListeningTimedOut() implements ConversationTrigger {
    }

    record TurnFailed(Throwable cause) implements ConversationTrigger {
    }
}
