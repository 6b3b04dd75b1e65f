/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.error;

public class RefreshInProgressException extends AlertDispatchException {
    public RefreshInProgressException() {
        super("Target refresh already in progress");
    }

    @Override
    public String getCode() {
        return "refresh_in_progress";
    }
}
