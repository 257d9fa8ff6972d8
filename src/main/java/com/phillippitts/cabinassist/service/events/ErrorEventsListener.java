package com.phillippitts.cabinassist.service.events;

import com.phillippitts.cabinassist.service.recovery.ComponentFailureEvent;
import com.phillippitts.cabinassist.service.recovery.ComponentRecoveredEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized log handler for component failure and recovery events. Throttled per component
 * to avoid log spam while a provider keeps timing out.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onComponentFailure(ComponentFailureEvent e) {
        if (e.fromRecovery()) {
            // Always logged: recovery gave up on this component
            LOG.error("Component {} could not be recovered: {}", e.component(), e.message());
            return;
        }
        if (shouldLog("failure-" + e.component())) {
            LOG.warn("Component failure: component={}, reason={}, context={}",
                    e.component(), e.message(), e.context());
        }
    }

    @EventListener
    void onComponentRecovered(ComponentRecoveredEvent e) {
        lastLog.remove("failure-" + e.component());
        LOG.info("Component {} recovered after {} attempt(s)", e.component(), e.attempts());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
