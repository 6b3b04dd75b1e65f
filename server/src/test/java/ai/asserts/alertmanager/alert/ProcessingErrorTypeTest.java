/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.alert;

import ai.asserts.alertmanager.error.PipelineTimeoutException;
import ai.asserts.alertmanager.error.PublishException;
import ai.asserts.alertmanager.error.StorageException;
import ai.asserts.alertmanager.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ProcessingErrorTypeTest {
    @Test
    public void classifyByType() {
        assertEquals(ProcessingErrorType.STORAGE, ProcessingErrorType.classify(new StorageException("x")));
        assertEquals(ProcessingErrorType.PROCESSOR, ProcessingErrorType.classify(new PublishException("x")));
        assertEquals(ProcessingErrorType.VALIDATION, ProcessingErrorType.classify(new ValidationException("x")));
        assertEquals(ProcessingErrorType.TIMEOUT, ProcessingErrorType.classify(new PipelineTimeoutException("x")));
        assertEquals(ProcessingErrorType.TIMEOUT, ProcessingErrorType.classify(new TimeoutException()));
    }

    @Test
    public void classifyByMessage() {
        assertEquals(ProcessingErrorType.STORAGE,
                ProcessingErrorType.classify(new IllegalStateException("Postgres connection refused")));
        assertEquals(ProcessingErrorType.PROCESSOR,
                ProcessingErrorType.classify(new RuntimeException("processing queue full")));
        assertEquals(ProcessingErrorType.VALIDATION,
                ProcessingErrorType.classify(new IllegalArgumentException("invalid label name")));
        assertEquals(ProcessingErrorType.TIMEOUT,
                ProcessingErrorType.classify(new RuntimeException("context deadline exceeded")));
        assertEquals(ProcessingErrorType.UNKNOWN, ProcessingErrorType.classify(new NullPointerException()));
        assertEquals(ProcessingErrorType.UNKNOWN, ProcessingErrorType.classify(new RuntimeException("boom")));
    }
}
