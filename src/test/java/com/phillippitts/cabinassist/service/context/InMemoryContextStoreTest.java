package com.phillippitts.cabinassist.service.context;

import com.phillippitts.cabinassist.config.properties.ContextProperties;
import com.phillippitts.cabinassist.domain.ConversationContext;
import com.phillippitts.cabinassist.domain.ConversationTurn;
import com.phillippitts.cabinassist.exception.SchemaMismatchException;
import com.phillippitts.cabinassist.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryContextStoreTest {

    private MutableClock clock;
    private ContextProperties props;
    private InMemoryContextStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T08:00:00Z"));
        props = new ContextProperties();
        props.setWindowSize(3);
        props.setTtl(Duration.ofMinutes(30));
        store = new InMemoryContextStore(props, clock);
    }

    @Test
    void startsWithDefaults() {
        ConversationContext ctx = store.read();

        assertThat(ctx.history()).isEmpty();
        assertThat(ctx.currentIntent()).isNull();
        assertThat(ctx.entities()).isEmpty();
        assertThat(ctx.systemStatus()).containsEntry("status", "ready");
    }

    @Test
    void nestedUpdatesMergeInsteadOfReplacing() {
        store.updateVehicleState(Map.of("climate_control", Map.of("temperature", 22.0, "fan_speed", 2)));
        store.updateVehicleState(Map.of("climate_control", Map.of("temperature", 20.0)));

        @SuppressWarnings("unchecked")
        Map<String, Object> climate = (Map<String, Object>) store.read().vehicleState().get("climate_control");
        assertThat(climate).containsEntry("temperature", 20.0).containsEntry("fan_speed", 2);
    }

    @Test
    void laterUpdateWinsForSameLeaf() {
        store.update(Map.of(ConversationContext.USER_PREFERENCES, Map.of("units", "metric")));
        store.update(Map.of(ConversationContext.USER_PREFERENCES, Map.of("units", "imperial")));

        assertThat(store.read().userPreferences()).containsEntry("units", "imperial");
    }

    @Test
    void rejectsMappingOverScalarWithoutPartialApply() {
        store.update(Map.of(
                ConversationContext.CURRENT_INTENT, "navigation",
                ConversationContext.ENTITIES, Map.of("destination", "home")));

        Map<String, Object> bad = new LinkedHashMap<>();
        bad.put(ConversationContext.CURRENT_INTENT, "media_control");
        bad.put(ConversationContext.ENTITIES, Map.of("destination", Map.of("lat", 1.0)));

        assertThatThrownBy(() -> store.update(bad))
                .isInstanceOf(SchemaMismatchException.class)
                .satisfies(e -> assertThat(((SchemaMismatchException) e).getField()).isEqualTo("entities.destination"));

        ConversationContext ctx = store.read();
        assertThat(ctx.currentIntent()).isEqualTo("navigation");
        assertThat(ctx.entities()).containsEntry("destination", "home");
    }

    @Test
    void rejectsUnknownField() {
        assertThatThrownBy(() -> store.update(Map.of("mood", "happy")))
                .isInstanceOf(SchemaMismatchException.class);
    }

    @Test
    void historyKeepsOnlyTheNewestTurns() {
        for (int i = 1; i <= 5; i++) {
            store.appendTurn(ConversationTurn.assistant(clock.instant(), "turn " + i));
        }

        List<ConversationTurn> history = store.read().history();
        assertThat(history).extracting(ConversationTurn::text).containsExactly("turn 3", "turn 4", "turn 5");
        assertThat(store.recentHistory(2)).extracting(ConversationTurn::text).containsExactly("turn 4", "turn 5");
        assertThat(store.recentHistory(10)).hasSize(3);
    }

    @Test
    void snapshotsDoNotChangeAfterLaterUpdates() {
        store.update(Map.of(ConversationContext.ENTITIES, Map.of("temperature", 21)));
        ConversationContext before = store.read();

        store.update(Map.of(ConversationContext.ENTITIES, Map.of("temperature", 18)));

        assertThat(before.entities()).containsEntry("temperature", 21);
        assertThatThrownBy(() -> before.entities().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void resetsToDefaultsAfterTtl() {
        store.update(Map.of(ConversationContext.CURRENT_INTENT, "navigation"));
        store.appendTurn(ConversationTurn.assistant(clock.instant(), "hello"));

        clock.advance(Duration.ofMinutes(31));

        ConversationContext ctx = store.read();
        assertThat(ctx.currentIntent()).isNull();
        assertThat(ctx.history()).isEmpty();
    }

    @Test
    void activityWithinTtlKeepsContext() {
        store.update(Map.of(ConversationContext.CURRENT_INTENT, "navigation"));
        clock.advance(Duration.ofMinutes(20));
        store.appendTurn(ConversationTurn.assistant(clock.instant(), "still here"));
        clock.advance(Duration.ofMinutes(20));

        assertThat(store.read().currentIntent()).isEqualTo("navigation");
    }

    @Test
    void recordsLatestVehicleEventPerType() {
        store.recordVehicleEvent("low_fuel", Map.of("fuel_level", 12));
        clock.advance(Duration.ofSeconds(5));
        store.recordVehicleEvent("low_fuel", Map.of("fuel_level", 9));

        @SuppressWarnings("unchecked")
        Map<String, Object> events = (Map<String, Object>) store.read().vehicleState().get("events");
        @SuppressWarnings("unchecked")
        Map<String, Object> lowFuel = (Map<String, Object>) events.get("low_fuel");
        assertThat(lowFuel.get("payload")).isEqualTo(Map.of("fuel_level", 9));
        assertThat(lowFuel.get("at")).isEqualTo(clock.instant().toString());
    }

    @Test
    void summarizesSubsystems() {
        store.updateVehicleState(Map.of("climate_control", Map.of("temperature", 21.0)));
        store.update(Map.of(ConversationContext.CURRENT_INTENT, "climate_control",
                ConversationContext.ENTITIES, Map.of("temperature", 21)));

        ContextSummary summary = store.summarize();

        assertThat(summary.currentIntent()).isEqualTo("climate_control");
        assertThat(summary.entityCount()).isEqualTo(1);
        assertThat(summary.climate()).containsEntry("temperature", 21.0);
        assertThat(summary.media()).isEmpty();
        assertThat(summary.systemStatus()).isEqualTo("ready");
    }

    @Test
    void concurrentWritersNeverLoseDistinctKeys() throws Exception {
        int writers = 8;
        int perWriter = 50;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch go = new CountDownLatch(1);
        List<Exception> errors = new ArrayList<>();
        try {
            for (int w = 0; w < writers; w++) {
                int writer = w;
                pool.execute(() -> {
                    try {
                        go.await();
                        for (int i = 0; i < perWriter; i++) {
                            store.updateUserPreferences(Map.of("w" + writer, Map.of("k" + i, i)));
                        }
                    } catch (Exception e) {
                        synchronized (errors) {
                            errors.add(e);
                        }
                    }
                });
            }
            go.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(errors).isEmpty();
        Map<String, Object> prefs = store.read().userPreferences();
        assertThat(prefs).hasSize(writers);
        for (int w = 0; w < writers; w++) {
            assertThat((Map<?, ?>) prefs.get("w" + w)).hasSize(perWriter);
        }
    }

    @Test
    void rejectsNonPositiveWindow() {
        props.setWindowSize(0);
        assertThatThrownBy(() -> new InMemoryContextStore(props, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void vehicleRefreshesDoNotPostponeExpiry() {
        store.appendTurn(ConversationTurn.assistant(clock.instant(), "hello"));

        for (int minute = 1; minute <= 31; minute++) {
            clock.advance(Duration.ofMinutes(1));
            store.updateVehicleState(Map.of("vehicle", Map.of("speed", minute)));
            store.recordVehicleEvent("speed_change", Map.of("speed", minute));
        }

        assertThat(store.read().history()).isEmpty();
    }

    @Test
    void unchangedVehicleStateLeavesLastUpdate() {
        store.updateVehicleState(Map.of("media", Map.of("volume", 10)));
        Instant stamped = store.read().lastUpdate();

        clock.advance(Duration.ofSeconds(30));
        store.updateVehicleState(Map.of("media", Map.of("volume", 10)));
        assertThat(store.read().lastUpdate()).isEqualTo(stamped);

        store.updateVehicleState(Map.of("media", Map.of("volume", 12)));
        assertThat(store.read().lastUpdate()).isEqualTo(clock.instant());
    }

    @Test
    void conversationWritesAlwaysRefreshLastUpdate() {
        store.update(Map.of(ConversationContext.CURRENT_INTENT, "navigation"));
        clock.advance(Duration.ofSeconds(30));

        store.update(Map.of(ConversationContext.CURRENT_INTENT, "navigation"));

        assertThat(store.read().lastUpdate()).isEqualTo(clock.instant());
    }
}
