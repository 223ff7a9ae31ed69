package com.ai.clinic.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ProblemDetail handleNotFound(NotFoundException ex) {
        log.warn("{}: {}", ex.getErrorCode(), ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, ex.getEntity() + " Not Found", ex);
    }

    @ExceptionHandler(NoCapacityException.class)
    public ProblemDetail handleNoCapacity(NoCapacityException ex) {
        log.warn("{}: {}", ex.getErrorCode(), ex.getMessage());
        return problem(HttpStatus.CONFLICT, "No Capacity", ex);
    }

    @ExceptionHandler({DuplicateDoctorException.class, DuplicateSlotException.class})
    public ProblemDetail handleDuplicate(ClinicException ex) {
        log.warn("{}: {}", ex.getErrorCode(), ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Already Exists", ex);
    }

    @ExceptionHandler(InvalidActionException.class)
    public ProblemDetail handleInvalidAction(InvalidActionException ex) {
        log.error("Undo log is inconsistent", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Invalid Action", ex);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, message);
        problem.setTitle("Validation Error");
        return problem;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Malformed request body");
        problem.setTitle("Bad Request");
        return problem;
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST,
                "Invalid value for '" + ex.getName() + "': " + ex.getValue());
        problem.setTitle("Bad Request");
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneral(Exception ex) {
        // Spring MVC exceptions (unknown route, wrong method, missing parameter) carry their own status
        if (ex instanceof ErrorResponse errorResponse) {
            log.debug("Request rejected: {}", ex.getMessage());
            return errorResponse.getBody();
        }
        log.error("Unhandled exception", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        return problem;
    }

    private static ProblemDetail problem(HttpStatus status, String title, ClinicException ex) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problem.setTitle(title);
        problem.setProperty("errorCode", ex.getErrorCode());
        return problem;
    }
}
