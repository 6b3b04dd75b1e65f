/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.alert;

import ai.asserts.alertmanager.model.Alert;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class DedupResult {
    private final DedupAction action;
    /**
     * State after deduplication, as stored
     */
    private final Alert alert;
    /**
     * <code>null</code> for newly created alerts
     */
    private final Transition transition;
    private final boolean flapping;
}
