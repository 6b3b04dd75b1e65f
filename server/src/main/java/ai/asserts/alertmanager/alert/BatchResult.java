/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.alert;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@AllArgsConstructor
@ToString
public class BatchResult {
    private final int received;
    private final int processed;
    private final List<AlertFailure> failures;

    public boolean isSuccess() {
        return failures.isEmpty();
    }

    public boolean isFailure() {
        return processed == 0 && !failures.isEmpty();
    }

    public boolean isPartial() {
        return processed > 0 && !failures.isEmpty();
    }
}
