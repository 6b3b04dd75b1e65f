/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.error;

/**
 * Root of the exceptions raised by the alert dispatch service. Each subtype maps to one machine readable
 * error code at the API boundary.
 */
public abstract class AlertDispatchException extends RuntimeException {
    protected AlertDispatchException(String message) {
        super(message);
    }

    protected AlertDispatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getCode();
}
