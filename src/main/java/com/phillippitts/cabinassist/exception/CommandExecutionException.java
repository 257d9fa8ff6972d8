package com.phillippitts.cabinassist.exception;

/**
 * Thrown when a vehicle command payload is malformed (missing or mistyped parameters,
 * unknown command type).
 */
public class CommandExecutionException extends CabinAssistException {

    private final String commandType;

    public CommandExecutionException(String commandType, String reason) {
        super("Command '" + commandType + "' rejected: " + reason);
        this.commandType = commandType;
    }

    public CommandExecutionException(String commandType, String reason, Throwable cause) {
        super("Command '" + commandType + "' rejected: " + reason, cause);
        this.commandType = commandType;
    }

    public String getCommandType() {
        return commandType;
    }
}
