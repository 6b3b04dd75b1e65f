/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.alert;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

@Getter
@AllArgsConstructor
@ToString
public class IngestResponse {
    public static final String SUCCESS = "success";
    public static final String PARTIAL = "partial";
    public static final String ERROR = "error";

    private final String status;
    private final Data data;

    public static IngestResponse of(BatchResult result, Instant timestamp) {
        String status = result.isSuccess() ? SUCCESS : result.isFailure() ? ERROR : PARTIAL;
        return new IngestResponse(status, new Data(result.getReceived(), result.getProcessed(),
                result.getFailures().size(), result.getFailures(), timestamp));
    }

    @Getter
    @AllArgsConstructor
    @ToString
    public static class Data {
        private final int received;
        private final int processed;
        private final int failed;
        private final List<AlertFailure> errors;
        private final Instant timestamp;
    }
}
