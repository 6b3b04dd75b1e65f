/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.enrichment;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
public class FilterDecision {
    public static final FilterDecision ALLOW = new FilterDecision(true, null);

    private final boolean allowed;
    private final String reason;

    public static FilterDecision deny(String reason) {
        return new FilterDecision(false, reason);
    }
}
