package com.phillippitts.cabinassist.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Time bound applied to calls into speech, understanding, dialogue and vehicle providers.
 */
@Validated
@ConfigurationProperties(prefix = "provider")
public class ProviderProperties {

    @NotNull
    private Duration callTimeout = Duration.ofSeconds(5);

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }
}
