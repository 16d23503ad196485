package com.dashboard.insights.controller;

import com.dashboard.insights.exception.AnalysisFailedException;
import com.dashboard.insights.exception.InsufficientDataException;
import com.dashboard.insights.exception.InvalidConfigurationException;
import com.dashboard.insights.exception.ModelConvergenceException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.util.Map;

/**
 * Maps analysis failures to RFC 7807 problem responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private static final String PROBLEM_BASE = "https://dashboard-insights.dev/problems/";

    private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
            HttpStatus.BAD_REQUEST, "invalid-request",
            HttpStatus.UNPROCESSABLE_ENTITY, "analysis-failed",
            HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
    );

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<ProblemDetail> handleInsufficientData(InsufficientDataException ex,
                                                                HttpServletRequest request) {
        ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.BAD_REQUEST, "insufficient-data", ex, request);
        response.getBody().setProperty("required", ex.getRequired());
        response.getBody().setProperty("actual", ex.getActual());
        return response;
    }

    @ExceptionHandler({InvalidConfigurationException.class, IllegalArgumentException.class,
            MethodArgumentNotValidException.class, ConstraintViolationException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
        return buildProblem(HttpStatus.BAD_REQUEST, null, ex, request);
    }

    @ExceptionHandler(ModelConvergenceException.class)
    public ResponseEntity<ProblemDetail> handleConvergence(ModelConvergenceException ex, HttpServletRequest request) {
        return buildProblem(HttpStatus.UNPROCESSABLE_ENTITY, "model-convergence", ex, request);
    }

    @ExceptionHandler(AnalysisFailedException.class)
    public ResponseEntity<ProblemDetail> handleAnalysisFailed(AnalysisFailedException ex, HttpServletRequest request) {
        ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.UNPROCESSABLE_ENTITY, null, ex, request);
        response.getBody().setProperty("failures", ex.getFailures());
        return response;
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
        return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, null, ex, request);
    }

    private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, String slug, Exception ex,
                                                       HttpServletRequest request) {
        logException(status, ex, request);
        ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, message(ex));
        detail.setTitle(status.getReasonPhrase());
        detail.setInstance(URI.create(request.getRequestURI()));
        detail.setType(URI.create(PROBLEM_BASE + (slug != null ? slug : TYPE_SLUGS.getOrDefault(status, "internal-error"))));
        detail.setProperty("path", request.getRequestURI());
        return ResponseEntity.status(status).body(detail);
    }

    private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
        if (status.is5xxServerError()) {
            log.error("Request {} {} failed with status {}: {}",
                    request.getMethod(), request.getRequestURI(), status.value(), message(ex), ex);
        } else {
            log.warn("Request {} {} returned status {}: {}",
                    request.getMethod(), request.getRequestURI(), status.value(), message(ex));
        }
    }

    private static String message(Exception ex) {
        if (ex instanceof MethodArgumentNotValidException invalid) {
            return invalid.getBindingResult().getFieldErrors().stream()
                    .map(error -> error.getField() + " " + error.getDefaultMessage())
                    .reduce((a, b) -> a + "; " + b)
                    .orElse("Validation failed");
        }
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getName() : message;
    }
}
