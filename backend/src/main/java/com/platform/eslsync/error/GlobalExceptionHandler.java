package com.platform.eslsync.error;

import com.platform.eslsync.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.UUID;

/**
 * Global exception handler for the operator REST endpoints.
 * 
 * Converts exceptions to standardized ErrorResponse,
 * logs with severity derived from the error category
 * and tracks error metrics.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private final MetricsRegistry metricsRegistry;
    
    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }
    
    @ExceptionHandler(EslSyncException.class)
    public ResponseEntity<ErrorResponse> handleEslSyncException(
            EslSyncException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        
        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }
        recordMetric(errorCode);
        
        ErrorResponse response = ErrorResponse.of(
            errorCode, ex.getMessage(), status.value(), request.getRequestURI(), traceId);
        return ResponseEntity.status(status).body(response);
    }
    
    @ExceptionHandler({
        IllegalArgumentException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadArgument(
            Exception ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Validation error: {}", traceId, ex.getMessage());
        recordMetric(ErrorCode.VALIDATION_ERROR);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.VALIDATION_ERROR, ex.getMessage(),
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        recordMetric(ErrorCode.MISSING_REQUIRED_FIELD);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.MISSING_REQUIRED_FIELD,
            String.format("Required parameter '%s' is missing", ex.getParameterName()),
            HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        return ResponseEntity.badRequest().body(response);
    }
    
    // ==================== Catch-All ====================
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.INTERNAL_ERROR);
        
        ErrorResponse response = ErrorResponse.builder()
            .code(ErrorCode.INTERNAL_ERROR.getCode())
            .message("An unexpected error occurred")
            .detail(ex.getClass().getSimpleName() + ": " + ex.getMessage())
            .fatal(true)
            .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
            .timestamp(java.time.Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .build();
        
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
    
    // ==================== Helpers ====================
    
    private String getOrCreateTraceId() {
        String traceId = MDC.get("traceId");
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
            MDC.put("traceId", traceId);
        }
        return traceId;
    }
    
    private void recordMetric(ErrorCode errorCode) {
        metricsRegistry.incrementCounter("esl.errors",
            "code", errorCode.getCode(),
            "fatal", String.valueOf(errorCode.isFatal()));
    }
    
    private HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case VERIFICATION_IN_PROGRESS -> HttpStatus.CONFLICT;
            case VALIDATION_ERROR, MISSING_REQUIRED_FIELD -> HttpStatus.BAD_REQUEST;
            case DATABASE_ERROR, AIMS_UNAVAILABLE, AIMS_REQUEST_FAILED, AIMS_NOT_CONFIGURED, RESYNC_QUEUE_ERROR ->
                HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
