/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.publishing;

import ai.asserts.alertmanager.config.TargetConfig;

public interface TargetValidator {
    /**
     * @return the candidate as a target, marked valid or invalid. Never throws for an unreachable target.
     */
    PublishingTarget validate(TargetConfig candidate);
}
