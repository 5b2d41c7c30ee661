package com.project.image.editdetection.exceptions;

import com.project.image.editdetection.controller.ComparisonApiController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/** RFC 7807 problem details for the JSON endpoint. Runs ahead of the view handler. */
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice(assignableTypes = ComparisonApiController.class)
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(DetectionTimeoutException.class)
    public ProblemDetail handleTimeout(DetectionTimeoutException ex) {
        log.warn("Detection timed out: {}", ex.getMessage());
        return problem(HttpStatus.GATEWAY_TIMEOUT, "Detection timed out", ex.getMessage());
    }

    @ExceptionHandler(TaskRejectedException.class)
    public ProblemDetail handleRejected(TaskRejectedException ex) {
        log.warn("Perceptual pool is saturated: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Detector busy",
                "Too many perceptual comparisons are running. Please retry shortly.");
    }

    @ExceptionHandler(EditDetectionException.class)
    public ProblemDetail handleDomainExceptions(EditDetectionException ex) {
        log.warn("Domain error: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid image", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidationErrors(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Validation error: {}", detail);
        return problem(HttpStatus.BAD_REQUEST, "Invalid request", detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid request", "Request body is not valid JSON for a comparison");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid options", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnknownException(Exception ex) {
        log.error("Unhandled error occurred", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error", "An unexpected error occurred");
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, detail);
        pd.setTitle(title);
        return pd;
    }
}
