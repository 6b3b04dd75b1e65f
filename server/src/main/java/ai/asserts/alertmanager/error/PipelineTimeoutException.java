/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.error;

public class PipelineTimeoutException extends AlertDispatchException {
    public PipelineTimeoutException(String message) {
        super(message);
    }

    public PipelineTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "timeout";
    }
}
