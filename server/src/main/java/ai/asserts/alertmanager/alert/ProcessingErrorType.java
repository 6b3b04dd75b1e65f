/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.alert;

import ai.asserts.alertmanager.error.PipelineTimeoutException;
import ai.asserts.alertmanager.error.PublishException;
import ai.asserts.alertmanager.error.StorageException;
import ai.asserts.alertmanager.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;
import java.util.concurrent.TimeoutException;

@AllArgsConstructor
@Getter
public enum ProcessingErrorType {
    STORAGE("storage_error"),
    PROCESSOR("processor_error"),
    VALIDATION("validation_error"),
    TIMEOUT("timeout_error"),
    UNKNOWN("unknown_error");

    @JsonValue
    private final String id;

    /**
     * Classifies by exception type first and falls back to keywords in the message.
     */
    public static ProcessingErrorType classify(Throwable e) {
        if (e instanceof StorageException) {
            return STORAGE;
        } else if (e instanceof PublishException) {
            return PROCESSOR;
        } else if (e instanceof ValidationException) {
            return VALIDATION;
        } else if (e instanceof PipelineTimeoutException || e instanceof TimeoutException) {
            return TIMEOUT;
        }

        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (containsAny(message, "storage", "database", "postgres", "sql")) {
            return STORAGE;
        } else if (containsAny(message, "processor", "processing")) {
            return PROCESSOR;
        } else if (containsAny(message, "validation", "invalid")) {
            return VALIDATION;
        } else if (containsAny(message, "timeout", "deadline", "context")) {
            return TIMEOUT;
        }
        return UNKNOWN;
    }

    private static boolean containsAny(String message, String... keywords) {
        for (String keyword : keywords) {
            if (message.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
