package com.docflow.workflow.api;

import com.docflow.workflow.api.dto.ErrorResponse;
import com.docflow.workflow.exception.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps engine exceptions to HTTP responses.
 *
 *   400  validation problems, missing X-Docflow-User header
 *   403  actor may not perform the operation
 *   404  unknown instance, definition or document
 *   409  illegal state change, second active instance, concurrent update
 *   500  inconsistent stored state
 */
@RestControllerAdvice
public class WorkflowExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExceptionHandler.class);

    @ExceptionHandler(WorkflowValidationException.class)
    public ResponseEntity<ErrorResponse> validation(WorkflowValidationException e) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status)
                .body(new ErrorResponse(status.value(), status.getReasonPhrase(), e.getMessage(), e.getProblems()));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> missingHeader(MissingRequestHeaderException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(UnauthorizedActionException.class)
    public ResponseEntity<ErrorResponse> unauthorized(UnauthorizedActionException e) {
        return error(HttpStatus.FORBIDDEN, e.getMessage());
    }

    @ExceptionHandler(WorkflowNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(WorkflowNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({InvalidTransitionException.class, ActiveInstanceExistsException.class})
    public ResponseEntity<ErrorResponse> conflict(WorkflowException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> concurrentUpdate(OptimisticLockingFailureException e) {
        log.warn("Concurrent update rejected: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, "The workflow instance was modified concurrently; reload and retry");
    }

    @ExceptionHandler(InconsistentStateException.class)
    public ResponseEntity<ErrorResponse> inconsistent(InconsistentStateException e) {
        log.error("Inconsistent workflow state: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(WorkflowException.class)
    public ResponseEntity<ErrorResponse> other(WorkflowException e) {
        log.error("Unhandled workflow error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(status.value(), status.getReasonPhrase(), message));
    }
}
