package com.platform.faultorchestrator.error;

/**
 * Base exception for all fault orchestrator exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class FaultOrchestratorException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected FaultOrchestratorException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected FaultOrchestratorException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected FaultOrchestratorException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
