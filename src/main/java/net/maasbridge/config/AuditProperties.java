package net.maasbridge.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings for the structured audit log.
 */
@Component
@ConfigurationProperties(prefix = "maas.audit")
public class AuditProperties {

    /**
     * Whether audit events are written at all.
     */
    private boolean enabled = true;

    /**
     * Include the served payload under {@code details.resourceState}.
     */
    private boolean includeResourceState = false;

    /**
     * Replace values of sensitive keys with a mask.
     */
    private boolean maskSensitiveFields = true;

    /**
     * Case-insensitive substrings identifying sensitive keys.
     */
    private List<String> sensitiveFields = new ArrayList<>(List.of("password", "token", "secret", "key", "credential"));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isIncludeResourceState() {
        return includeResourceState;
    }

    public void setIncludeResourceState(boolean includeResourceState) {
        this.includeResourceState = includeResourceState;
    }

    public boolean isMaskSensitiveFields() {
        return maskSensitiveFields;
    }

    public void setMaskSensitiveFields(boolean maskSensitiveFields) {
        this.maskSensitiveFields = maskSensitiveFields;
    }

    public List<String> getSensitiveFields() {
        return sensitiveFields;
    }

    public void setSensitiveFields(List<String> sensitiveFields) {
        this.sensitiveFields = sensitiveFields;
    }
}
