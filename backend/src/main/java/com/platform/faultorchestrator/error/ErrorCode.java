package com.platform.faultorchestrator.error;

/**
 * Standardized error codes for the fault orchestrator.
 * Each error has a unique code that clients can use to take specific actions.
 * 
 * Format: FO-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: Collaborator errors (metrics, remediation)
 * - 5xx: Injection / cascade errors
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("FO-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_FAULT_DURATION("FO-101", "Requested fault duration must be positive", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    UNKNOWN_FAULT_KIND("FO-300", "Unknown fault kind", ErrorCategory.RECOVERABLE),
    FAULT_NOT_ACTIVE("FO-301", "No active fault of this kind", ErrorCategory.RECOVERABLE),
    FAULT_IN_COOLDOWN("FO-310", "Fault kind is in cooldown", ErrorCategory.RECOVERABLE),
    
    // ==================== Collaborator Errors (4xx) ====================
    
    METRICS_UNAVAILABLE("FO-400", "System metrics unavailable", ErrorCategory.RECOVERABLE),
    REMEDIATION_FAILED("FO-410", "Remediation step failed", ErrorCategory.RECOVERABLE),
    
    // ==================== Injection Errors (5xx) ====================
    
    CASCADE_DEPTH_EXHAUSTED("FO-500", "Cascade depth budget exhausted", ErrorCategory.RECOVERABLE),
    ORCHESTRATOR_SHUTTING_DOWN("FO-510", "Orchestrator is shutting down", ErrorCategory.FATAL),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("FO-900", "Internal server error", ErrorCategory.FATAL),
    CONFIGURATION_ERROR("FO-902", "Configuration error", ErrorCategory.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - client can retry or fix the request.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - orchestrator is in a state that rejects the request outright.
         */
        FATAL
    }
}
