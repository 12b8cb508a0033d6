package com.platform.faultorchestrator.error;

import com.platform.faultorchestrator.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Global exception handler for all REST controllers.
 * 
 * Converts exceptions to standardized ErrorResponse, logs them with a
 * severity matching their category and counts them per error code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private final MetricsRegistry metricsRegistry;
    
    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }
    
    // ==================== Orchestrator Exceptions ====================
    
    @ExceptionHandler(FaultOrchestratorException.class)
    public ResponseEntity<ErrorResponse> handleOrchestratorException(
            FaultOrchestratorException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        
        logError(ex, errorCode, traceId);
        recordMetric(errorCode);
        
        ErrorResponse response = ErrorResponse.of(
            errorCode, ex.getMessage(), status.value(), request.getRequestURI(), traceId);
        
        return ResponseEntity.status(status).body(response);
    }
    
    @ExceptionHandler(FaultInjectionException.class)
    public ResponseEntity<ErrorResponse> handleFaultInjection(
            FaultInjectionException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        
        logError(ex, errorCode, traceId);
        recordMetric(errorCode);
        
        Map<String, Object> metadata = new HashMap<>();
        if (ex.getFaultKind() != null) {
            metadata.put("faultKind", ex.getFaultKind());
        }
        
        ErrorResponse response = ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(ex.getMessage())
            .fatal(errorCode.isFatal())
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .metadata(metadata)
            .build();
        
        return ResponseEntity.status(status).body(response);
    }
    
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Resource not found: {} ({})", 
            traceId, ex.getResourceType(), ex.getResourceId());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = ErrorResponse.builder()
            .code(ex.getErrorCode().getCode())
            .message(ex.getMessage())
            .fatal(false)
            .status(HttpStatus.NOT_FOUND.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .metadata(Map.of(
                "resourceType", ex.getResourceType(),
                "resourceId", ex.getResourceId()
            ))
            .build();
        
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }
    
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Validation error: {}", traceId, ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse.ErrorResponseBuilder builder = ErrorResponse.builder()
            .code(ex.getErrorCode().getCode())
            .message(ex.getMessage())
            .fatal(false)
            .status(HttpStatus.BAD_REQUEST.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId);
        
        if (ex.getField() != null) {
            builder.fieldErrors(List.of(
                ErrorResponse.FieldError.builder()
                    .field(ex.getField())
                    .message(ex.getMessage())
                    .rejectedValue(ex.getRejectedValue())
                    .build()
            ));
        }
        
        return ResponseEntity.badRequest().body(builder.build());
    }
    
    // ==================== Request Errors ====================
    
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Type mismatch: {} = {}", traceId, ex.getName(), ex.getValue());
        recordMetric(ErrorCode.VALIDATION_ERROR);
        
        ErrorResponse response = ErrorResponse.of(
            ErrorCode.VALIDATION_ERROR,
            String.format("Invalid value for parameter '%s': %s", ex.getName(), ex.getValue()),
            HttpStatus.BAD_REQUEST.value(),
            request.getRequestURI(),
            traceId);
        
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
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .build();
        
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
    
    // ==================== Helpers ====================
    
    private String getOrCreateTraceId() {
        String traceId = MDC.get("correlationId");
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
        }
        return traceId;
    }
    
    private void logError(FaultOrchestratorException ex, ErrorCode errorCode, String traceId) {
        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }
    }
    
    private void recordMetric(ErrorCode errorCode) {
        metricsRegistry.incrementCounter("faultorchestrator.errors",
            "code", errorCode.getCode(),
            "fatal", String.valueOf(errorCode.isFatal()));
    }
    
    static HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case UNKNOWN_FAULT_KIND, FAULT_NOT_ACTIVE -> 
                HttpStatus.NOT_FOUND;
            case FAULT_IN_COOLDOWN, CASCADE_DEPTH_EXHAUSTED -> 
                HttpStatus.CONFLICT;
            case VALIDATION_ERROR, INVALID_FAULT_DURATION ->
                HttpStatus.BAD_REQUEST;
            case ORCHESTRATOR_SHUTTING_DOWN, METRICS_UNAVAILABLE ->
                HttpStatus.SERVICE_UNAVAILABLE;
            default -> 
                HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
