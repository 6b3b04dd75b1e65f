/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.error;

/**
 * Concurrent modification detected. The caller must re-fetch before retrying.
 */
public class ConflictException extends AlertDispatchException {
    public ConflictException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "conflict";
    }
}
