/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.publishing;

import ai.asserts.alertmanager.config.TargetConfig;

import java.util.List;

public interface TargetDiscovery {
    /**
     * @return candidate targets; may throw when the source of candidates is unavailable
     */
    List<TargetConfig> discover();
}
