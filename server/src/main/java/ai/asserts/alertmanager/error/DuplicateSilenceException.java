/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.error;

import lombok.Getter;

@Getter
public class DuplicateSilenceException extends AlertDispatchException {
    private final String existingId;

    public DuplicateSilenceException(String existingId) {
        super("An identical silence already exists: " + existingId);
        this.existingId = existingId;
    }

    @Override
    public String getCode() {
        return "duplicate";
    }
}
