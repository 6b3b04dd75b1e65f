/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Process level switch. When disabled the scheduled sweeps, refreshes and config reloads are no-ops while the
 * HTTP API stays up.
 */
@Component
public class EnvironmentConfig {
    private final boolean enabled;

    public EnvironmentConfig(@Value("${alertmanager.enabled:true}") String enabled) {
        this.enabled =
                "true".equalsIgnoreCase(enabled) || "yes".equalsIgnoreCase(enabled) || "y".equalsIgnoreCase(
                        enabled);
    }

    public boolean isDisabled() {
        return !enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }
}
