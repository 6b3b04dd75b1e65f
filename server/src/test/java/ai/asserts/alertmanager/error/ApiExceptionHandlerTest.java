/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.error;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ApiExceptionHandlerTest {
    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    public void validation() {
        ResponseEntity<ErrorResponse> response = handler.validation(
                new ValidationException("invalid silence", ImmutableMap.of("comment", "too short")));
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("invalid silence", response.getBody().getError());
        assertEquals("validation_error", response.getBody().getCode());
        assertEquals(ImmutableMap.of("comment", "too short"), response.getBody().getDetails());
    }

    @Test
    public void statusCodes() {
        assertEquals(HttpStatus.NOT_FOUND, handler.notFound(new NotFoundException("no silence")).getStatusCode());
        assertEquals(HttpStatus.CONFLICT, handler.conflict(new DuplicateSilenceException("s1")).getStatusCode());
        assertEquals(HttpStatus.CONFLICT, handler.conflict(new ConflictException("stale")).getStatusCode());
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE,
                handler.unavailable(new RefreshInProgressException()).getStatusCode());
        assertEquals(HttpStatus.PAYLOAD_TOO_LARGE,
                handler.tooLarge(new RequestTooLargeException("too many")).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST,
                handler.unreadable(new MissingServletRequestParameterException("limit", "int")).getStatusCode());
    }

    @Test
    public void rateLimited() {
        ResponseEntity<ErrorResponse> response = handler.rateLimited(
                new RefreshRateLimitedException(Duration.ofMillis(41500)));
        assertEquals(HttpStatus.TOO_MANY_REQUESTS, response.getStatusCode());
        assertEquals("42", response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
        assertEquals("rate_limited", response.getBody().getCode());
    }
}
