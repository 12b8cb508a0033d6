package com.platform.faultorchestrator.error;

/**
 * Thrown by a metrics provider when a snapshot cannot be collected.
 * Never reaches injection callers: recovery treats it as an empty snapshot.
 */
public class MetricsUnavailableException extends FaultOrchestratorException {
    
    public MetricsUnavailableException(String message) {
        super(ErrorCode.METRICS_UNAVAILABLE, message);
    }
    
    public MetricsUnavailableException(String message, Throwable cause) {
        super(ErrorCode.METRICS_UNAVAILABLE, message, cause);
    }
}
