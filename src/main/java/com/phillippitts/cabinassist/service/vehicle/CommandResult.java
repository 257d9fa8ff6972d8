package com.phillippitts.cabinassist.service.vehicle;

import com.phillippitts.cabinassist.domain.PendingCommand;

import java.util.Objects;

/**
 * Outcome of executing one {@link PendingCommand}.
 *
 * @param command the executed command
 * @param success whether the vehicle accepted it
 * @param message short diagnostic
 */
public record CommandResult(PendingCommand command, boolean success, String message) {

    public CommandResult {
        Objects.requireNonNull(command, "command");
        message = message == null ? "" : message;
    }
}
