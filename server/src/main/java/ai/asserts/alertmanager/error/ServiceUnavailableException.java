/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.error;

public class ServiceUnavailableException extends AlertDispatchException {
    public ServiceUnavailableException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "unavailable";
    }
}
