package com.phillippitts.cabinassist.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Startup integrity verification settings.
 *
 * <p>{@code integrity.files} maps a file path to its expected lowercase hex SHA-256 digest.
 * An empty map means there is nothing to verify.
 */
@ConfigurationProperties(prefix = "integrity")
public class IntegrityProperties {

    private boolean enabled = true;

    private Map<String, String> files = new LinkedHashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Map<String, String> getFiles() {
        return files;
    }

    public void setFiles(Map<String, String> files) {
        this.files = files;
    }
}
