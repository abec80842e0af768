package com.riskplatform.engine.exception;

import com.riskplatform.common.exception.InvalidInputException;
import com.riskplatform.common.exception.NumericalDegeneracyException;
import com.riskplatform.common.exception.RiskEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;

/**
 * Input errors → 400, numerical degeneracy → 422. Anything else is left to Spring's
 * default 500 handling.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(InvalidInputException e) {
        log.warn("Rejected request. component={} message={}", e.getComponent(), e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(NumericalDegeneracyException.class)
    public ResponseEntity<ErrorResponse> handleDegeneracy(NumericalDegeneracyException e) {
        log.warn("Numerical degeneracy. component={} message={}", e.getComponent(), e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(ServerWebInputException e) {
        log.warn("Unreadable request body: {}", e.getReason());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorResponse(Instant.now(),
            HttpStatus.BAD_REQUEST.value(), HttpStatus.BAD_REQUEST.getReasonPhrase(), e.getReason(), "request"));
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, RiskEngineException e) {
        return ResponseEntity.status(status).body(new ErrorResponse(Instant.now(), status.value(),
            status.getReasonPhrase(), e.getMessage(), e.getComponent()));
    }
}
