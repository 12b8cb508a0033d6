package com.platform.faultorchestrator.fault.behavior;

import com.platform.faultorchestrator.fault.FaultConfig;
import com.platform.faultorchestrator.fault.FaultKind;
import com.platform.faultorchestrator.metrics.SyntheticLoad;

/**
 * Each collection pass reclaims half of what is left; the final pass reclaims the rest.
 */
class MemoryLeakBehavior extends AbstractFaultBehavior {
    
    MemoryLeakBehavior(FaultConfig config, SyntheticLoad load) {
        super(FaultKind.MEMORY_LEAK, config, load);
    }
    
    @Override
    protected boolean relieve(int step, int totalSteps) {
        if (isLastStep(step, totalSteps)) {
            load.clear(kind);
        } else {
            load.scale(kind, 0.5);
        }
        return true;
    }
}
