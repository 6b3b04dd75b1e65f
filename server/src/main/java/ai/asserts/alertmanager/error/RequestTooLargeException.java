/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.error;

public class RequestTooLargeException extends AlertDispatchException {
    public RequestTooLargeException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "payload_too_large";
    }
}
