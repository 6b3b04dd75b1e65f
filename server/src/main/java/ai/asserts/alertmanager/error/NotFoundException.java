/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.error;

public class NotFoundException extends AlertDispatchException {
    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "not_found";
    }
}
