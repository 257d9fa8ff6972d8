package com.phillippitts.cabinassist.service.vehicle;

import com.phillippitts.cabinassist.domain.CommandType;
import com.phillippitts.cabinassist.domain.ContextMaps;
import com.phillippitts.cabinassist.domain.PendingCommand;
import com.phillippitts.cabinassist.exception.CommandExecutionException;
import com.phillippitts.cabinassist.exception.ComponentFailureException;
import com.phillippitts.cabinassist.service.lifecycle.ComponentNames;
import com.phillippitts.cabinassist.service.lifecycle.ProviderCallGuard;
import com.phillippitts.cabinassist.service.metrics.AssistantMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO queue of pending vehicle commands with a single draining consumer.
 *
 * <p>Any thread may {@link #enqueue(PendingCommand)}; {@link #drain()} holds a lock for the whole
 * pass so commands are executed one at a time, in enqueue order, at most once per enqueue.
 *
 * <p>A malformed command or unknown type yields a failed {@link CommandResult}; the remaining
 * commands still run. Link failures are reported through {@link ProviderCallGuard} and likewise
 * produce a failed result.
 */
public class VehicleCommandExecutor {

    private static final Logger LOG = LogManager.getLogger(VehicleCommandExecutor.class);

    private final Queue<PendingCommand> queue = new ConcurrentLinkedQueue<>();
    private final ReentrantLock drainLock = new ReentrantLock();
    private final VehicleLink vehicle;
    private final ProviderCallGuard guard;
    private final AssistantMetricsPublisher metrics;

    public VehicleCommandExecutor(VehicleLink vehicle, ProviderCallGuard guard, AssistantMetricsPublisher metrics) {
        this.vehicle = Objects.requireNonNull(vehicle, "vehicle");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.metrics = metrics == null ? AssistantMetricsPublisher.NOOP : metrics;
    }

    public void enqueue(PendingCommand command) {
        queue.add(Objects.requireNonNull(command, "command"));
    }

    public void enqueueAll(List<PendingCommand> commands) {
        commands.forEach(this::enqueue);
    }

    public int pendingCount() {
        return queue.size();
    }

    /**
     * Executes every queued command in FIFO order.
     *
     * @return one result per executed command, in execution order
     */
    public List<CommandResult> drain() {
        List<CommandResult> results = new ArrayList<>();
        drainLock.lock();
        try {
            PendingCommand command;
            while ((command = queue.poll()) != null) {
                CommandResult result = execute(command);
                metrics.recordCommand(command.type(), result.success());
                results.add(result);
            }
        } finally {
            drainLock.unlock();
        }
        return results;
    }

    private CommandResult execute(PendingCommand command) {
        try {
            boolean accepted = guard.call(ComponentNames.VEHICLE_INTEGRATION, () -> dispatch(command));
            if (!accepted) {
                LOG.warn("Vehicle rejected command type={}", command.type());
            }
            return new CommandResult(command, accepted, accepted ? "ok" : "rejected by vehicle");
        } catch (CommandExecutionException e) {
            LOG.warn("Invalid command: {}", e.getMessage());
            return new CommandResult(command, false, e.getMessage());
        } catch (ComponentFailureException e) {
            LOG.error("Command type={} failed: {}", command.type(), e.getMessage());
            return new CommandResult(command, false, e.getMessage());
        }
    }

    private boolean dispatch(PendingCommand command) {
        CommandType type = CommandType.fromWireName(command.type())
                .orElseThrow(() -> new CommandExecutionException(command.type(), "unknown command type"));
        Map<String, Object> p = command.parameters();
        LOG.debug("Executing command type={} params={}", command.type(), p.keySet());
        return switch (type) {
            case CLIMATE_CONTROL -> {
                Double temperature = optionalNumber(command, "temperature").map(Number::doubleValue).orElse(null);
                Integer fanSpeed = optionalNumber(command, "fan_speed").map(Number::intValue).orElse(null);
                if (temperature == null && fanSpeed == null) {
                    throw new CommandExecutionException(command.type(), "requires temperature or fan_speed");
                }
                yield vehicle.setClimate(temperature, fanSpeed, optionalString(command, "zone"));
            }
            case NAVIGATION -> {
                String destination = optionalString(command, "destination");
                if (destination == null || destination.isBlank()) {
                    throw new CommandExecutionException(command.type(), "requires a destination");
                }
                yield vehicle.setNavigationDestination(destination, optionalMap(command, "route_preferences"));
            }
            case MEDIA -> {
                String action = optionalString(command, "action");
                if (action == null || action.isBlank()) {
                    throw new CommandExecutionException(command.type(), "requires an action");
                }
                yield vehicle.controlMedia(action, optionalString(command, "source"),
                        optionalString(command, "content"));
            }
            case VEHICLE_SETTINGS -> {
                if (p.isEmpty()) {
                    throw new CommandExecutionException(command.type(), "requires at least one setting");
                }
                yield vehicle.updateSettings(p);
            }
        };
    }

    private static Optional<Number> optionalNumber(PendingCommand command, String key) {
        Object value = command.parameters().get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number n) {
            return Optional.of(n);
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Double.valueOf(s.trim()));
            } catch (NumberFormatException e) {
                throw new CommandExecutionException(command.type(), key + " is not a number: " + s);
            }
        }
        throw new CommandExecutionException(command.type(), key + " must be numeric");
    }

    private static String optionalString(PendingCommand command, String key) {
        Object value = command.parameters().get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            throw new CommandExecutionException(command.type(), key + " must be a string");
        }
        return value.toString();
    }

    private static Map<String, Object> optionalMap(PendingCommand command, String key) {
        Object value = command.parameters().get(key);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> m) {
            return ContextMaps.frozenCopy(m);
        }
        throw new CommandExecutionException(command.type(), key + " must be a mapping");
    }
}
