/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.alert;

import ai.asserts.alertmanager.ObjectMapperFactory;
import ai.asserts.alertmanager.TestClock;
import ai.asserts.alertmanager.config.LabelMatcher;
import ai.asserts.alertmanager.error.RequestTooLargeException;
import ai.asserts.alertmanager.error.ValidationException;
import ai.asserts.alertmanager.model.Alert;
import ai.asserts.alertmanager.model.AlertStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import org.easymock.Capture;
import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.expect;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AlertControllerTest extends EasyMockSupport {
    private static final Instant NOW = Instant.parse("2023-06-01T10:00:00Z");

    private AlertProcessingPipeline pipeline;
    private AlertQueryService queryService;
    private ObjectMapperFactory objectMapperFactory;
    private AlertController controller;

    @BeforeEach
    public void setup() {
        pipeline = mock(AlertProcessingPipeline.class);
        queryService = mock(AlertQueryService.class);
        objectMapperFactory = new ObjectMapperFactory();
        controller = new AlertController(pipeline, queryService, objectMapperFactory, new TestClock(NOW), 30000, 2);
    }

    @Test
    public void ingest_prometheusArray() throws JsonProcessingException {
        Capture<List<Alert>> alerts = Capture.newInstance();
        expect(pipeline.process(capture(alerts), anyObject(Deadline.class)))
                .andReturn(new BatchResult(1, 1, ImmutableList.of()));
        replayAll();

        ResponseEntity<IngestResponse> response = controller.ingest(json("[{\"labels\":{\"alertname\":\"HighCPU\","
                + "\"instance\":\"a\"},\"annotations\":{\"summary\":\"cpu\"},"
                + "\"startsAt\":\"2023-06-01T09:59:00Z\",\"generatorURL\":\"http://prom/graph\"}]"));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        IngestResponse body = response.getBody();
        assertEquals(IngestResponse.SUCCESS, body.getStatus());
        assertEquals(1, body.getData().getReceived());
        assertEquals(1, body.getData().getProcessed());
        assertEquals(0, body.getData().getFailed());
        assertEquals(NOW, body.getData().getTimestamp());

        Alert alert = alerts.getValue().get(0);
        assertEquals("HighCPU", alert.getName());
        assertEquals("cpu", alert.getAnnotations().get("summary"));
        assertEquals(Instant.parse("2023-06-01T09:59:00Z"), alert.getStartsAt());
        assertNull(alert.getStatus());
        verifyAll();
    }

    @Test
    public void ingest_webhookGroupPartial() throws JsonProcessingException {
        AlertFailure failure = AlertFailure.builder()
                .index(1)
                .alertname("DiskFull")
                .error("database unavailable")
                .errorType(ProcessingErrorType.STORAGE)
                .build();
        expect(pipeline.process(anyObject(), anyObject(Deadline.class)))
                .andReturn(new BatchResult(2, 1, ImmutableList.of(failure)));
        replayAll();

        ResponseEntity<IngestResponse> response = controller.ingest(json("{\"receiver\":\"x\",\"alerts\":["
                + "{\"status\":\"firing\",\"labels\":{\"alertname\":\"HighCPU\"}},"
                + "{\"status\":\"resolved\",\"labels\":{\"alertname\":\"DiskFull\"}}]}"));

        assertEquals(HttpStatus.MULTI_STATUS, response.getStatusCode());
        assertEquals(IngestResponse.PARTIAL, response.getBody().getStatus());
        assertEquals(ImmutableList.of(failure), response.getBody().getData().getErrors());
        verifyAll();
    }

    @Test
    public void ingest_allFailed() throws JsonProcessingException {
        expect(pipeline.process(anyObject(), anyObject(Deadline.class)))
                .andReturn(new BatchResult(1, 0, ImmutableList.of(AlertFailure.builder()
                        .index(0)
                        .error("boom")
                        .errorType(ProcessingErrorType.UNKNOWN)
                        .build())));
        replayAll();

        ResponseEntity<IngestResponse> response = controller.ingest(json("[{\"labels\":{\"alertname\":\"A\"}}]"));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals(IngestResponse.ERROR, response.getBody().getStatus());
        verifyAll();
    }

    @Test
    public void ingest_rejected() {
        replayAll();
        assertThrows(ValidationException.class, () -> controller.ingest(json("[]")));
        assertThrows(ValidationException.class, () -> controller.ingest(json("{\"receiver\":\"x\"}")));
        assertThrows(ValidationException.class, () -> controller.ingest(json("\"alerts\"")));
        assertThrows(ValidationException.class, () -> controller.ingest(json("[{\"labels\":{}}]")));
        assertThrows(ValidationException.class,
                () -> controller.ingest(json("[{\"labels\":{\"alertname\":\"A\"},\"startsAt\":\"yesterday\"}]")));
        assertThrows(RequestTooLargeException.class, () -> controller.ingest(json(
                "[{\"labels\":{\"a\":\"1\"}},{\"labels\":{\"a\":\"2\"}},{\"labels\":{\"a\":\"3\"}}]")));
        verifyAll();
    }

    @Test
    @SuppressWarnings("unchecked")
    public void list() {
        Capture<AlertQuery> query = Capture.newInstance();
        expect(queryService.query(capture(query))).andReturn(new AlertPage(ImmutableList.of(), 0, 10, 5));
        replayAll();

        ResponseEntity<Map<String, Object>> response = controller.list("{alertname=~\"High.*\"}", "Firing",
                "warning", "2023-06-01T00:00:00Z", null, true, null, 10, 5, "alertname", "asc");

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("success", response.getBody().get("status"));
        Map<String, Object> data = (Map<String, Object>) response.getBody().get("data");
        assertEquals(0, data.get("total"));
        assertEquals(10, data.get("limit"));
        assertEquals(5, data.get("offset"));

        AlertQuery captured = query.getValue();
        assertEquals(ImmutableList.of(LabelMatcher.regex("alertname", "High.*")), captured.getMatchers());
        assertEquals(AlertStatus.firing, captured.getStatus());
        assertEquals("warning", captured.getSeverity());
        assertEquals(Instant.parse("2023-06-01T00:00:00Z"), captured.getStartsAfter());
        assertTrue(captured.getSilenced());
        assertNull(captured.getInhibited());
        assertEquals(AlertSortField.ALERT_NAME, captured.getSort());
        assertTrue(captured.isAscending());
        assertFalse(captured.getMatchers().isEmpty());
        verifyAll();
    }

    @Test
    public void list_invalidParameters() {
        replayAll();
        assertThrows(ValidationException.class, () -> controller.list(null, null, null, null, null, null, null,
                100, 0, "startsAt", "sideways"));
        assertThrows(ValidationException.class, () -> controller.list(null, "pending", null, null, null, null,
                null, 100, 0, "startsAt", "desc"));
        assertThrows(ValidationException.class, () -> controller.list(null, null, null, "today", null, null,
                null, 100, 0, "startsAt", "desc"));
        assertThrows(ValidationException.class, () -> controller.list(null, null, null, null, null, null,
                null, 100, 0, "fingerprint", "desc"));
        verifyAll();
    }

    private JsonNode json(String body) throws JsonProcessingException {
        return objectMapperFactory.getJsonMapper().readTree(body);
    }
}
