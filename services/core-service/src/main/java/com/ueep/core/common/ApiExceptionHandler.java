package com.ueep.core.common;

import com.ueep.core.data.DataNotFoundException;
import com.ueep.core.data.DependencyUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final NodeIdentity nodeIdentity;
    private final Clock clock;

    public ApiExceptionHandler(NodeIdentity nodeIdentity, Clock clock) {
        this.nodeIdentity = nodeIdentity;
        this.clock = clock;
    }

    @ExceptionHandler(DependencyUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(DependencyUnavailableException ex) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "dependency_unavailable", ex.getMessage());
    }

    @ExceptionHandler(DataNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(DataNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        logger.error(
            "unexpected_exception correlation_id={} method={} path={}",
            RequestContextHolder.correlationId(),
            request == null ? null : request.getMethod(),
            request == null ? null : request.getRequestURI(),
            ex
        );
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error");
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message) {
        ErrorResponse response = new ErrorResponse(code, message, RequestContextHolder.correlationId());
        response.setNode(nodeIdentity.getHostname());
        response.setTimestamp(clock.instant().toString());
        return ResponseEntity.status(status).body(response);
    }
}
