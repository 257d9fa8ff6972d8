package com.phillippitts.cabinassist.domain;

import java.util.List;
import java.util.Map;

/**
 * Dialogue collaborator's answer to one user turn.
 *
 * @param speechResponse  text to speak (may be empty)
 * @param commands        vehicle commands to execute before speaking
 * @param uiUpdate        optional UI payload for the head unit
 * @param endConversation whether the conversation ends after this response
 */
public record DialogueResponse(
        String speechResponse,
        List<PendingCommand> commands,
        Map<String, Object> uiUpdate,
        boolean endConversation
) {
    public DialogueResponse {
        speechResponse = speechResponse == null ? "" : speechResponse;
        commands = commands == null ? List.of() : List.copyOf(commands);
        uiUpdate = ContextMaps.frozenCopy(uiUpdate);
    }

    public static DialogueResponse speech(String text, boolean endConversation) {
        return new DialogueResponse(text, List.of(), Map.of(), endConversation);
    }
}
