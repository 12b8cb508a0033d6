package com.platform.faultorchestrator.fault;

import com.platform.faultorchestrator.error.ErrorCode;
import com.platform.faultorchestrator.error.FaultOrchestratorException;

import java.time.Duration;

/**
 * Outcome of an injection request.
 * 
 * @param kind              resolved kind, {@code null} if the requested name matched no kind
 * @param requestedKind     name as requested
 * @param rejection         reason code when not accepted
 * @param effectiveDuration clamped duration when accepted
 */
public record InjectionResult(
    FaultKind kind,
    String requestedKind,
    boolean accepted,
    ErrorCode rejection,
    String reason,
    Duration effectiveDuration,
    int cascadeDepth
) {
    public static InjectionResult accepted(FaultKind kind, Duration effectiveDuration, int cascadeDepth) {
        return new InjectionResult(kind, kind.getDisplayName(), true, null, null, effectiveDuration, cascadeDepth);
    }
    
    public static InjectionResult rejected(FaultKind kind, String requestedKind, 
                                           FaultOrchestratorException cause, int cascadeDepth) {
        return new InjectionResult(kind, requestedKind, false, cause.getErrorCode(), cause.getMessage(), 
            null, cascadeDepth);
    }
}
