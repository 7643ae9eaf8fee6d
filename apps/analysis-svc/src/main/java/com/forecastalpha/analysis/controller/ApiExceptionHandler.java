package com.forecastalpha.analysis.controller;

import com.forecastalpha.analysis.analytics.MissingColumnsException;
import com.forecastalpha.analysis.controller.dto.ErrorResponseDto;
import com.forecastalpha.analysis.datasource.ConnectionFailedException;
import com.forecastalpha.analysis.datasource.DataSourceException;
import com.forecastalpha.analysis.datasource.UnknownConnectionException;
import com.forecastalpha.analysis.web.RequestContextHolder;
import com.forecastalpha.analysis.web.TraceIdFilter;
import jakarta.validation.ConstraintViolationException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MissingColumnsException.class)
    public ResponseEntity<ErrorResponseDto> handleMissingColumns(MissingColumnsException ex) {
        return build(HttpStatus.BAD_REQUEST, "MISSING_COLUMNS", "Missing columns in dataset",
                Map.of("missing_columns", ex.missingColumns()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            ConstraintViolationException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            HandlerMethodValidationException.class
    })
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(UnknownConnectionException.class)
    public ResponseEntity<ErrorResponseDto> handleUnknownConnection(UnknownConnectionException ex) {
        return build(HttpStatus.NOT_FOUND, "UNKNOWN_CONNECTION", "Unknown connection_id", Map.of());
    }

    @ExceptionHandler(ConnectionFailedException.class)
    public ResponseEntity<ErrorResponseDto> handleConnectionFailed(ConnectionFailedException ex) {
        return build(HttpStatus.BAD_REQUEST, "CONNECTION_FAILED", "Unable to connect to database",
                reason(ex));
    }

    @ExceptionHandler(DataSourceException.class)
    public ResponseEntity<ErrorResponseDto> handleDataSource(DataSourceException ex) {
        log.warn("Data source failure: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "DATA_SOURCE_ERROR", ex.getMessage(), reason(ex));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", reason(ex));
    }

    private static Map<String, Object> reason(Exception ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        // Map.of rejects null values
        Map<String, Object> details = new HashMap<>();
        if (cause.getMessage() != null) {
            details.put("reason", cause.getMessage());
        }
        return details;
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.traceId().orElseGet(() -> MDC.get(TraceIdFilter.MDC_KEY));
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details, traceId));
    }
}
