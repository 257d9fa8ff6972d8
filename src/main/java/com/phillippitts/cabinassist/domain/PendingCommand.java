package com.phillippitts.cabinassist.domain;

import java.util.Map;
import java.util.Objects;

/**
 * A vehicle instruction issued by dialogue or a proactive trigger, awaiting execution.
 *
 * <p>The type is kept as its wire string so unknown types survive until the executor
 * rejects them explicitly.
 *
 * @param type       command type wire name (see {@link CommandType})
 * @param parameters command parameters
 */
public record PendingCommand(String type, Map<String, Object> parameters) {

    public PendingCommand {
        Objects.requireNonNull(type, "type");
        parameters = ContextMaps.frozenCopy(parameters);
    }

    public static PendingCommand of(CommandType type, Map<String, Object> parameters) {
        return new PendingCommand(type.wireName(), parameters);
    }
}
