package com.platform.faultorchestrator.fault.behavior;

/**
 * Synthetic effect and recovery sequence of one fault kind.
 */
public interface FaultBehavior {
    
    /**
     * Apply the fault's effect to the monitored metrics.
     */
    void simulate();
    
    /**
     * Execute recovery step {@code step} (0-based).
     * 
     * @return true if the step succeeded
     */
    boolean recover(int step);
}
