package com.cloudwise.costanalytics.controller;

import com.cloudwise.costanalytics.analytics.CostAnalysisException;
import com.cloudwise.costanalytics.analytics.DegenerateInputException;
import com.cloudwise.costanalytics.analytics.InsufficientDataException;
import com.cloudwise.costanalytics.controller.dto.ErrorResponseDto;
import com.cloudwise.costanalytics.web.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CostAnalysisException.class)
    public ResponseEntity<ErrorResponseDto> handleAnalysis(CostAnalysisException ex) {
        HttpStatus status = ex instanceof InsufficientDataException || ex instanceof DegenerateInputException
                ? HttpStatus.UNPROCESSABLE_ENTITY
                : HttpStatus.BAD_REQUEST;
        log.info("analysis_rejected code={} reason={}", ex.code(), ex.getMessage());
        return build(status, ex.code(), ex.getMessage(), ex.details());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDto> handleUnreadable(HttpMessageNotReadableException ex) {
        return build(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body is not valid JSON for this endpoint",
                Map.of("reason", String.valueOf(ex.getMostSpecificCause().getMessage())));
    }

    @ExceptionHandler({
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class,
            ErrorResponseException.class
    })
    public ResponseEntity<ErrorResponseDto> handleFramework(Exception ex) {
        ErrorResponse response = (ErrorResponse) ex;
        HttpStatusCode status = response.getStatusCode();
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String code = resolved != null ? resolved.name() : "HTTP_" + status.value();
        log.info("request_rejected status={} reason={}", status.value(), ex.getMessage());
        return ResponseEntity.status(status)
                .headers(response.getHeaders())
                .body(new ErrorResponseDto(code, ex.getMessage(), Map.of(), RequestContextHolder.traceId().orElse(null)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("analysis_failed", ex);
        Map<String, Object> details = new HashMap<>();
        details.put("reason", ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", details);
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatusCode status, String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details, traceId));
    }
}
