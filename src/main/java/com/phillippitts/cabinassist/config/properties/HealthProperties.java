package com.phillippitts.cabinassist.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for component health probing.
 */
@Validated
@ConfigurationProperties(prefix = "health")
public class HealthProperties {

    /** Upper bound for a single component probe; a probe exceeding it counts as failed. */
    @NotNull
    private Duration probeTimeout = Duration.ofSeconds(2);

    /** Interval between health checks while the assistant is active. */
    @NotNull
    private Duration checkInterval = Duration.ofSeconds(30);

    public Duration getProbeTimeout() {
        return probeTimeout;
    }

    public void setProbeTimeout(Duration probeTimeout) {
        this.probeTimeout = probeTimeout;
    }

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public void setCheckInterval(Duration checkInterval) {
        this.checkInterval = checkInterval;
    }
}
