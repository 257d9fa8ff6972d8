package com.phillippitts.cabinassist.exception;

/**
 * Thrown when a call into an external collaborator fails or exceeds its time bound.
 * Transient: the failing component is handed to health monitoring and recovery,
 * the orchestrator itself keeps running.
 */
public class ComponentFailureException extends CabinAssistException {

    private final String componentName;

    public ComponentFailureException(String message, String componentName) {
        super(message + " (component: " + componentName + ")");
        this.componentName = componentName;
    }

    public ComponentFailureException(String message, String componentName, Throwable cause) {
        super(message + " (component: " + componentName + ")", cause);
        this.componentName = componentName;
    }

    public String getComponentName() {
        return componentName;
    }
}
