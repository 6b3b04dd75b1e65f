/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager;

import ai.asserts.alertmanager.config.DispatchConfig;

public interface DispatchConfigProvider {
    /**
     * @return the last successfully loaded and validated configuration. Never <code>null</code>.
     */
    DispatchConfig getConfig();

    void update();
}
