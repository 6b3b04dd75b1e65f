/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.error;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps the service exceptions to a closed set of status codes and machine readable error codes.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> validation(ValidationException e) {
        return respond(HttpStatus.BAD_REQUEST, e, new HttpHeaders());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e, new HttpHeaders());
    }

    @ExceptionHandler({ConflictException.class, DuplicateSilenceException.class})
    public ResponseEntity<ErrorResponse> conflict(AlertDispatchException e) {
        return respond(HttpStatus.CONFLICT, e, new HttpHeaders());
    }

    @ExceptionHandler({RefreshInProgressException.class, ServiceUnavailableException.class})
    public ResponseEntity<ErrorResponse> unavailable(AlertDispatchException e) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e, new HttpHeaders());
    }

    @ExceptionHandler(RefreshRateLimitedException.class)
    public ResponseEntity<ErrorResponse> rateLimited(RefreshRateLimitedException e) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()));
        return respond(HttpStatus.TOO_MANY_REQUESTS, e, headers);
    }

    @ExceptionHandler(RequestTooLargeException.class)
    public ResponseEntity<ErrorResponse> tooLarge(RequestTooLargeException e) {
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, e, new HttpHeaders());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> unreadable(Exception e) {
        log.debug("Rejected malformed request", e);
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .error("Malformed request: " + e.getMessage())
                .code("validation_error")
                .build());
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, AlertDispatchException e, HttpHeaders headers) {
        if (status.is5xxServerError()) {
            log.warn("{}: {}", e.getCode(), e.getMessage());
        } else {
            log.debug("{}: {}", e.getCode(), e.getMessage());
        }
        ErrorResponse.ErrorResponseBuilder body = ErrorResponse.builder()
                .error(e.getMessage())
                .code(e.getCode());
        if (e instanceof ValidationException) {
            body.details(((ValidationException) e).getDetails());
        }
        return ResponseEntity.status(status).headers(headers).body(body.build());
    }
}
