package com.phillippitts.cabinassist.service.lifecycle;

/**
 * Uniform lifecycle contract exposed by every collaborator the orchestrator coordinates.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #start()} prepares the component (connects, loads models, opens devices)</li>
 *   <li>{@link #healthCheck()} is probed periodically with a bounded timeout</li>
 *   <li>{@link #restart()} is invoked by recovery when the component is unhealthy</li>
 *   <li>{@link #stop()} releases resources at shutdown</li>
 * </ol>
 *
 * <p>Implementations should make {@link #stop()} idempotent; the orchestrator may call it
 * during an emergency shutdown on a component that never started.
 */
public interface ManagedComponent {

    /**
     * Stable component name used for health reports, recovery and logging
     * (see {@link ComponentNames}).
     */
    String name();

    /**
     * Starts the component.
     *
     * @throws com.phillippitts.cabinassist.exception.ComponentFailureException if start fails
     */
    void start();

    /**
     * Stops the component and releases its resources.
     */
    void stop();

    /**
     * Restarts the component. The default is stop followed by start.
     *
     * @throws com.phillippitts.cabinassist.exception.ComponentFailureException if the restart fails
     */
    default void restart() {
        stop();
        start();
    }

    /**
     * Liveness probe. Must be cheap; the caller bounds it with a timeout.
     *
     * @return true if the component is operational
     */
    boolean healthCheck();
}
