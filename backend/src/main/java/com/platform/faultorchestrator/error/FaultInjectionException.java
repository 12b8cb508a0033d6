package com.platform.faultorchestrator.error;

import java.time.Duration;

/**
 * Exception for rejected fault injections.
 */
public class FaultInjectionException extends FaultOrchestratorException {
    
    private final String faultKind;
    
    public FaultInjectionException(ErrorCode errorCode, String faultKind, String message) {
        super(errorCode, message);
        this.faultKind = faultKind;
    }
    
    public static FaultInjectionException unknownKind(String faultKind) {
        return new FaultInjectionException(
            ErrorCode.UNKNOWN_FAULT_KIND,
            faultKind,
            String.format("Unknown fault kind: %s", faultKind)
        );
    }
    
    public static FaultInjectionException inCooldown(String faultKind, Duration remaining) {
        return new FaultInjectionException(
            ErrorCode.FAULT_IN_COOLDOWN,
            faultKind,
            String.format("Fault %s is in cooldown for another %ds", faultKind, remaining.toSeconds())
        );
    }
    
    public static FaultInjectionException invalidDuration(String faultKind, Duration requested) {
        return new FaultInjectionException(
            ErrorCode.INVALID_FAULT_DURATION,
            faultKind,
            String.format("Invalid duration %ds for fault %s", requested.toSeconds(), faultKind)
        );
    }
    
    public static FaultInjectionException cascadeDepthExhausted(String faultKind, int depth, int maxDepth) {
        return new FaultInjectionException(
            ErrorCode.CASCADE_DEPTH_EXHAUSTED,
            faultKind,
            String.format("Cascade into %s at depth %d exceeds budget %d", faultKind, depth, maxDepth)
        );
    }
    
    public static FaultInjectionException shuttingDown(String faultKind) {
        return new FaultInjectionException(
            ErrorCode.ORCHESTRATOR_SHUTTING_DOWN,
            faultKind,
            String.format("Cannot inject %s: orchestrator is shutting down", faultKind)
        );
    }
    
    public String getFaultKind() {
        return faultKind;
    }
}
