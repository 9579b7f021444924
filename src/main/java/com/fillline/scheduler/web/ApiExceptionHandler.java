package com.fillline.scheduler.web;

import com.fillline.scheduler.domain.LotIssue;
import com.fillline.scheduler.exception.InfeasibleScheduleException;
import com.fillline.scheduler.exception.PreflightFailedException;
import com.fillline.scheduler.exception.ScheduleInvariantException;
import com.fillline.scheduler.exception.SolverSizeLimitException;
import com.fillline.scheduler.exception.SolverTimeoutException;
import com.fillline.scheduler.exception.SolverUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Maps scheduling failures to HTTP statuses. Invariant violations are server faults: a strategy
 * produced an illegal schedule.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(PreflightFailedException.class)
    public ResponseEntity<ApiError> preflightFailed(PreflightFailedException e) {
        return respond(HttpStatus.BAD_REQUEST, e, e.getReport().getErrors());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> badRequest(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, e, List.of());
    }

    @ExceptionHandler({InfeasibleScheduleException.class, SolverSizeLimitException.class})
    public ResponseEntity<ApiError> unprocessable(RuntimeException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e, List.of());
    }

    @ExceptionHandler(SolverTimeoutException.class)
    public ResponseEntity<ApiError> timeout(SolverTimeoutException e) {
        return respond(HttpStatus.GATEWAY_TIMEOUT, e, List.of());
    }

    @ExceptionHandler(SolverUnavailableException.class)
    public ResponseEntity<ApiError> unavailable(SolverUnavailableException e) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e, List.of());
    }

    @ExceptionHandler(ScheduleInvariantException.class)
    public ResponseEntity<ApiError> invariant(ScheduleInvariantException e) {
        log.error("Produced schedule violates line rules", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e, List.of());
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, Exception e, List<LotIssue> issues) {
        ApiError body = new ApiError(status.value(), e.getClass().getSimpleName(), e.getMessage(), issues);
        return ResponseEntity.status(status).body(body);
    }
}
