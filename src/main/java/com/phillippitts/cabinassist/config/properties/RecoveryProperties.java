package com.phillippitts.cabinassist.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for component recovery.
 */
@Validated
@ConfigurationProperties(prefix = "recovery")
public class RecoveryProperties {

    /** Restart cycles allowed per failed component within one recovery pass. */
    @Positive(message = "Max restart attempts must be positive")
    private int maxRestartAttempts = 1;

    /** Upper bound for a single restart call. */
    @NotNull
    private Duration restartTimeout = Duration.ofSeconds(5);

    public int getMaxRestartAttempts() {
        return maxRestartAttempts;
    }

    public void setMaxRestartAttempts(int maxRestartAttempts) {
        this.maxRestartAttempts = maxRestartAttempts;
    }

    public Duration getRestartTimeout() {
        return restartTimeout;
    }

    public void setRestartTimeout(Duration restartTimeout) {
        this.restartTimeout = restartTimeout;
    }
}
