package com.phillippitts.cabinassist.service.context;

import com.phillippitts.cabinassist.config.properties.ContextProperties;
import com.phillippitts.cabinassist.domain.ContextMaps;
import com.phillippitts.cabinassist.domain.ConversationContext;
import com.phillippitts.cabinassist.domain.ConversationTurn;
import com.phillippitts.cabinassist.exception.SchemaMismatchException;
import com.phillippitts.cabinassist.service.lifecycle.ComponentNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory {@link ContextStore}, also registered as the {@code context_fusion} component.
 *
 * <p><b>Thread Safety:</b> every operation runs under one {@link ReentrantLock}. Updates are
 * applied to working copies and committed only when the whole merge succeeded, so a rejected
 * update leaves no trace. Snapshots are deep, unmodifiable copies.
 *
 * <p>The TTL is evaluated lazily at the start of each operation: a context with no conversation
 * activity for longer than {@code context.ttl} is reset to defaults before it is read or modified.
 * Conversation activity is an appended turn or a write to the current intent, the entities or the
 * user preferences. Vehicle state refreshes, vehicle events and system status writes do not count:
 * they move {@code lastUpdate} only when they change something, and never postpone the reset, so
 * periodic polling cannot keep a stale conversation alive.
 */
public final class InMemoryContextStore implements ContextStore {

    private static final Logger LOG = LogManager.getLogger(InMemoryContextStore.class);

    static final String EVENTS_KEY = "events";

    private static final Set<String> CONVERSATION_FIELDS = Set.of(
            ConversationContext.CURRENT_INTENT,
            ConversationContext.ENTITIES,
            ConversationContext.USER_PREFERENCES);

    private static final Set<String> MAP_FIELDS = Set.of(
            ConversationContext.ENTITIES,
            ConversationContext.VEHICLE_STATE,
            ConversationContext.USER_PREFERENCES,
            ConversationContext.SYSTEM_STATUS);

    private final ReentrantLock lock = new ReentrantLock();
    private final int windowSize;
    private final Duration ttl;
    private final Clock clock;

    private final Deque<ConversationTurn> history = new ArrayDeque<>();
    private String currentIntent;
    private Map<String, Map<String, Object>> maps = new LinkedHashMap<>();
    private Instant lastUpdate;
    private Instant lastActivity;
    private volatile boolean running;

    public InMemoryContextStore(ContextProperties properties, Clock clock) {
        Objects.requireNonNull(properties, "properties");
        this.windowSize = properties.getWindowSize();
        this.ttl = properties.getTtl();
        this.clock = Objects.requireNonNull(clock, "clock");
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive");
        }
        resetLocked();
    }

    @Override
    public ConversationContext read() {
        lock.lock();
        try {
            expireIfStale();
            return snapshot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void update(Map<String, Object> partial) {
        Objects.requireNonNull(partial, "partial");
        lock.lock();
        try {
            expireIfStale();
            // Work on copies; nothing below touches live state until every field merged cleanly
            String newIntent = currentIntent;
            Map<String, Map<String, Object>> working = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : partial.entrySet()) {
                String field = entry.getKey();
                Object value = entry.getValue();
                if (ConversationContext.CURRENT_INTENT.equals(field)) {
                    if (value != null && !(value instanceof String)) {
                        throw new SchemaMismatchException(field,
                                "expected a string but got " + value.getClass().getSimpleName());
                    }
                    newIntent = (String) value;
                } else if (MAP_FIELDS.contains(field)) {
                    if (!(value instanceof Map<?, ?>)) {
                        throw new SchemaMismatchException(field, "expected a mapping but got "
                                + (value == null ? "null" : value.getClass().getSimpleName()));
                    }
                    Map<String, Object> target = working.computeIfAbsent(field,
                            f -> ContextMaps.mutableCopy(maps.get(f)));
                    ContextMerger.mergeInto(target, (Map<?, ?>) value, field);
                } else {
                    throw new SchemaMismatchException(field, "unknown context field");
                }
            }
            boolean changed = !Objects.equals(newIntent, currentIntent)
                    || working.entrySet().stream().anyMatch(e -> !e.getValue().equals(maps.get(e.getKey())));
            currentIntent = newIntent;
            maps.putAll(working);
            boolean conversational = partial.keySet().stream().anyMatch(CONVERSATION_FIELDS::contains);
            if (changed || conversational) {
                touch();
            }
            if (conversational) {
                markActivity();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void appendTurn(ConversationTurn turn) {
        Objects.requireNonNull(turn, "turn");
        lock.lock();
        try {
            expireIfStale();
            history.addLast(turn);
            while (history.size() > windowSize) {
                history.removeFirst();
            }
            touch();
            markActivity();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            resetLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ConversationTurn> recentHistory(int turns) {
        if (turns < 0) {
            throw new IllegalArgumentException("turns must be >= 0");
        }
        lock.lock();
        try {
            expireIfStale();
            List<ConversationTurn> all = new ArrayList<>(history);
            return List.copyOf(all.subList(Math.max(0, all.size() - turns), all.size()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void updateVehicleState(Map<String, Object> state) {
        update(Map.of(ConversationContext.VEHICLE_STATE, state));
    }

    @Override
    public void updateUserPreferences(Map<String, Object> preferences) {
        update(Map.of(ConversationContext.USER_PREFERENCES, preferences));
    }

    @Override
    public void recordVehicleEvent(String eventType, Map<String, Object> payload) {
        Objects.requireNonNull(eventType, "eventType");
        lock.lock();
        try {
            expireIfStale();
            Map<String, Object> vehicle = ContextMaps.mutableCopy(maps.get(ConversationContext.VEHICLE_STATE));
            Object events = vehicle.get(EVENTS_KEY);
            if (events != null && !(events instanceof Map<?, ?>)) {
                throw new SchemaMismatchException(ConversationContext.VEHICLE_STATE + "." + EVENTS_KEY,
                        "expected a mapping but got " + events.getClass().getSimpleName());
            }
            Map<String, Object> occurrence = new LinkedHashMap<>();
            occurrence.put("payload", ContextMaps.mutableCopy(payload));
            occurrence.put("at", clock.instant().toString());
            // Last occurrence per type wins; payloads are not merged across occurrences
            Map<String, Object> byType = ContextMaps.mutableCopy((Map<?, ?>) events);
            byType.put(eventType, occurrence);
            vehicle.put(EVENTS_KEY, byType);
            maps.put(ConversationContext.VEHICLE_STATE, vehicle);
            touch();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ContextSummary summarize() {
        ConversationContext ctx = read();
        Map<String, Object> vehicle = ctx.vehicleState();
        Object status = ctx.systemStatus().get("status");
        return new ContextSummary(
                ctx.currentIntent(),
                ctx.entities().size(),
                ctx.history().size(),
                subsystem(vehicle, "climate_control"),
                subsystem(vehicle, "media"),
                subsystem(vehicle, "navigation"),
                ctx.userPreferences().size(),
                status == null ? "unknown" : status.toString(),
                ctx.lastUpdate());
    }

    @Override
    public String name() {
        return ComponentNames.CONTEXT_FUSION;
    }

    @Override
    public void start() {
        running = true;
        LOG.info("Context store started (window={}, ttl={})", windowSize, ttl);
    }

    @Override
    public void stop() {
        running = false;
    }

    @Override
    public void restart() {
        reset();
        start();
    }

    @Override
    public boolean healthCheck() {
        return running;
    }

    private static Map<String, Object> subsystem(Map<String, Object> vehicle, String key) {
        return vehicle.get(key) instanceof Map<?, ?> m ? ContextMaps.frozenCopy(m) : Map.of();
    }

    private void expireIfStale() {
        if (!ttl.isZero() && Duration.between(lastActivity, clock.instant()).compareTo(ttl) > 0) {
            LOG.info("No conversation activity for more than {}; resetting context to defaults", ttl);
            resetLocked();
        }
    }

    private void resetLocked() {
        ConversationContext defaults = ConversationContext.defaults(clock.instant());
        history.clear();
        currentIntent = defaults.currentIntent();
        maps = new LinkedHashMap<>();
        maps.put(ConversationContext.ENTITIES, ContextMaps.mutableCopy(defaults.entities()));
        maps.put(ConversationContext.VEHICLE_STATE, ContextMaps.mutableCopy(defaults.vehicleState()));
        maps.put(ConversationContext.USER_PREFERENCES, ContextMaps.mutableCopy(defaults.userPreferences()));
        maps.put(ConversationContext.SYSTEM_STATUS, ContextMaps.mutableCopy(defaults.systemStatus()));
        lastUpdate = defaults.lastUpdate();
        lastActivity = lastUpdate;
    }

    private void touch() {
        lastUpdate = clock.instant();
    }

    private void markActivity() {
        lastActivity = clock.instant();
    }

    private ConversationContext snapshot() {
        return new ConversationContext(
                new ArrayList<>(history),
                currentIntent,
                maps.get(ConversationContext.ENTITIES),
                maps.get(ConversationContext.VEHICLE_STATE),
                maps.get(ConversationContext.USER_PREFERENCES),
                maps.get(ConversationContext.SYSTEM_STATUS),
                lastUpdate);
    }
}
