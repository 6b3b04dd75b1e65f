/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.error;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Bad input. Never retried.
 */
@Getter
public class ValidationException extends AlertDispatchException {
    private final Map<String, String> details;

    public ValidationException(String message) {
        this(message, Collections.emptyMap());
    }

    public ValidationException(String message, Map<String, String> details) {
        super(message);
        this.details = new TreeMap<>(details);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
        this.details = Collections.emptyMap();
    }

    @Override
    public String getCode() {
        return "validation_error";
    }
}
