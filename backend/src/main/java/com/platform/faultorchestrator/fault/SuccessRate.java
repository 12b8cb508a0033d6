package com.platform.faultorchestrator.fault;

/**
 * Recovery attempts and successes for one kind.
 */
public record SuccessRate(long attempts, long successes) {
    
    public static final SuccessRate NONE = new SuccessRate(0, 0);
    
    /**
     * successes / attempts, or 0 when there were no attempts.
     */
    public double rate() {
        return attempts == 0 ? 0.0 : (double) successes / attempts;
    }
}
