package io.github.drompincen.commitments.gateway.controller;

import io.github.drompincen.commitments.protocol.api.ApiErrorResponse;
import io.github.drompincen.commitments.runtime.error.CommitmentNotFoundException;
import io.github.drompincen.commitments.runtime.error.CommitmentValidationException;
import io.github.drompincen.commitments.runtime.error.DuplicateLinkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps commitment errors to HTTP statuses for the REST controllers. */
@RestControllerAdvice(basePackages = "io.github.drompincen.commitments.gateway.controller")
public class CommitmentExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(CommitmentExceptionHandler.class);

    @ExceptionHandler(CommitmentValidationException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(CommitmentValidationException ex) {
        log.debug("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(CommitmentNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNotFound(CommitmentNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(DuplicateLinkException.class)
    public ResponseEntity<ApiErrorResponse> handleDuplicate(DuplicateLinkException ex) {
        log.info("Rejected duplicate link: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getMessage());
    }

    static ResponseEntity<ApiErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(new ApiErrorResponse(status.value(), status.getReasonPhrase(), message));
    }
}
