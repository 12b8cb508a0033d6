package com.platform.faultorchestrator.error;

/**
 * Thrown by a remediation action that could not complete a recovery step.
 */
public class RemediationFailedException extends FaultOrchestratorException {
    
    private final String faultKind;
    private final int step;
    
    public RemediationFailedException(String faultKind, int step, String reason) {
        super(ErrorCode.REMEDIATION_FAILED,
            String.format("Remediation step %d for %s failed: %s", step, faultKind, reason));
        this.faultKind = faultKind;
        this.step = step;
    }
    
    public String getFaultKind() {
        return faultKind;
    }
    
    public int getStep() {
        return step;
    }
}
