package com.phillippitts.cabinassist.service.dialogue;

import com.phillippitts.cabinassist.domain.ConversationContext;
import com.phillippitts.cabinassist.domain.DialogueResponse;
import com.phillippitts.cabinassist.domain.NluResult;
import com.phillippitts.cabinassist.domain.ProactiveNotification;
import com.phillippitts.cabinassist.service.lifecycle.ManagedComponent;

import java.util.Map;
import java.util.Optional;

/**
 * Dialogue generation collaborator.
 */
public interface DialogueEngine extends ManagedComponent {

    /**
     * Produces the response to one user turn.
     */
    DialogueResponse processTurn(NluResult nluResult, ConversationContext context);

    /**
     * Decides whether a vehicle event warrants a system-initiated notification.
     *
     * @return the notification, or empty when the event should pass silently
     */
    Optional<ProactiveNotification> checkProactiveTrigger(String eventType,
                                                          Map<String, Object> eventData,
                                                          ConversationContext context);
}
