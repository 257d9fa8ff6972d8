package com.phillippitts.cabinassist.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the shared context store.
 */
@Validated
@ConfigurationProperties(prefix = "context")
public class ContextProperties {

    /** Number of most recent turns kept in conversation history. */
    @Positive(message = "Window size must be positive")
    private int windowSize = 5;

    /** Idle time after which the context is reset to defaults on the next read. */
    @NotNull
    private Duration ttl = Duration.ofMinutes(30);

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }
}
