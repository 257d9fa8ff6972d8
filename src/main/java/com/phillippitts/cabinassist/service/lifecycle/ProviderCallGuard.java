package com.phillippitts.cabinassist.service.lifecycle;

import com.phillippitts.cabinassist.exception.CabinAssistException;
import com.phillippitts.cabinassist.exception.ComponentFailureException;
import com.phillippitts.cabinassist.service.recovery.ComponentFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Bounds calls into external providers (speech, understanding, dialogue, vehicle) with a
 * timeout and turns their failures into {@link ComponentFailureException}s.
 *
 * <p>Every timeout or unexpected provider exception publishes a {@link ComponentFailureEvent}
 * so health monitoring and recovery learn about it. Domain exceptions raised by the provider
 * on purpose (validation errors, for example) are rethrown unchanged and do not count as a
 * component failure.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * NluResult nlu = guard.call(ComponentNames.NLU, () -> understanding.process(text));
 * guard.run(ComponentNames.TTS, () -> speechOutput.speak(text, false));
 * }</pre>
 *
 * @since 1.0
 */
public final class ProviderCallGuard {

    private static final Logger LOG = LogManager.getLogger(ProviderCallGuard.class);

    private final Executor executor;
    private final Duration timeout;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    /**
     * @param executor  pool the provider call runs on
     * @param timeout   upper bound for each call
     * @param publisher event publisher for failure notifications (nullable)
     * @param clock     source of failure timestamps
     */
    public ProviderCallGuard(Executor executor, Duration timeout, ApplicationEventPublisher publisher, Clock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.publisher = publisher;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs {@code call} against {@code component} within the configured timeout.
     *
     * @return the provider's result
     * @throws ComponentFailureException on timeout, interruption or unexpected provider error
     */
    public <T> T call(String component, Supplier<T> call) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, executor);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            future.cancel(true);
            publishFailure(component, "call timed out after " + timeout.toMillis() + "ms", te);
            throw new ComponentFailureException("Provider call timed out after "
                    + timeout.toMillis() + "ms", component, te);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ComponentFailureException("Interrupted while waiting for provider", component, ie);
        } catch (ExecutionException ee) {
            throw translate(component, ee.getCause());
        }
    }

    /**
     * Void variant of {@link #call(String, Supplier)}.
     */
    public void run(String component, Runnable call) {
        call(component, () -> {
            call.run();
            return null;
        });
    }

    private RuntimeException translate(String component, Throwable cause) {
        if (cause instanceof ComponentFailureException cfe) {
            publishFailure(component, cfe.getMessage(), cfe);
            return cfe;
        }
        if (cause instanceof CabinAssistException domain) {
            return domain;
        }
        LOG.warn("Provider {} failed: {}", component, String.valueOf(cause));
        publishFailure(component, "provider error: " + cause, cause);
        return new ComponentFailureException("Provider call failed", component, cause);
    }

    private void publishFailure(String component, String message, Throwable cause) {
        if (publisher != null) {
            publisher.publishEvent(new ComponentFailureEvent(component, clock.instant(), message, cause,
                    Map.of("timeoutMs", String.valueOf(timeout.toMillis()))));
        }
    }
}
