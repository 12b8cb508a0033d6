package com.platform.faultorchestrator.fault;

/**
 * Per-kind, per-step recovery action. Best-effort and assumed idempotent.
 */
@FunctionalInterface
public interface RemediationAction {
    
    /**
     * Execute one recovery step.
     * 
     * @return true if the step succeeded
     * @throws com.platform.faultorchestrator.error.RemediationFailedException if the step failed
     */
    boolean remediate(FaultKind kind, int step);
}
