package com.marianbastiurea.parking.api.controller;

import com.marianbastiurea.parking.api.dto.ApiError;
import com.marianbastiurea.parking.domain.errors.AllocationNotFoundException;
import com.marianbastiurea.parking.domain.errors.ConflictException;
import com.marianbastiurea.parking.domain.errors.InvalidRequestException;
import com.marianbastiurea.parking.domain.errors.NotOccupiedException;
import com.marianbastiurea.parking.domain.errors.ScoringTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({InvalidRequestException.class, IllegalArgumentException.class})
    public ResponseEntity<ApiError> badRequest(RuntimeException e) {
        log.info("api.bad_request {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> unreadable(HttpMessageNotReadableException e) {
        log.info("api.unreadable_body {}", e.getMostSpecificCause().getMessage());
        return error(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(AllocationNotFoundException.class)
    public ResponseEntity<ApiError> notFound(AllocationNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({ConflictException.class, NotOccupiedException.class})
    public ResponseEntity<ApiError> conflict(RuntimeException e) {
        log.warn("api.conflict {}", e.getMessage());
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiError> rejectedByStore(DataIntegrityViolationException e) {
        log.warn("api.data_integrity {}", e.getMostSpecificCause().getMessage());
        return error(HttpStatus.BAD_REQUEST, "Request rejected by storage: " + e.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(ScoringTimeoutException.class)
    public ResponseEntity<ApiError> timeout(ScoringTimeoutException e) {
        log.warn("api.scoring_timeout {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(new ApiError(status.value(), status.getReasonPhrase(), message, Instant.now()));
    }
}
