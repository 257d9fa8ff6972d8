package com.phillippitts.cabinassist.exception;

import java.util.List;

/**
 * Thrown when one or more components stay failed after their restart budget is exhausted.
 * Fatal: the orchestrator escalates to emergency shutdown.
 */
public class RecoveryFailedException extends CabinAssistException {

    private final List<String> failedComponents;

    public RecoveryFailedException(List<String> failedComponents) {
        super("Components failed to recover: " + failedComponents);
        this.failedComponents = List.copyOf(failedComponents);
    }

    public List<String> getFailedComponents() {
        return failedComponents;
    }
}
