package com.phillippitts.cabinassist.domain;

import java.util.List;
import java.util.Objects;

/**
 * System-initiated utterance produced in reaction to a vehicle event.
 *
 * @param eventType vehicle event that triggered it (e.g. {@code low_fuel})
 * @param speech    text to speak
 * @param commands  commands to execute alongside the notification
 */
public record ProactiveNotification(String eventType, String speech, List<PendingCommand> commands) {

    public ProactiveNotification {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(speech, "speech");
        commands = commands == null ? List.of() : List.copyOf(commands);
    }
}
