package com.platform.faultorchestrator.fault.behavior;

import com.platform.faultorchestrator.fault.FaultConfig;
import com.platform.faultorchestrator.fault.FaultKind;
import com.platform.faultorchestrator.metrics.SyntheticLoad;

/**
 * Throttles I/O in equal slices.
 */
class IoStressBehavior extends AbstractFaultBehavior {
    
    IoStressBehavior(FaultConfig config, SyntheticLoad load) {
        super(FaultKind.IO_STRESS, config, load);
    }
    
    @Override
    protected boolean relieve(int step, int totalSteps) {
        double remaining = load.relieve(kind, 1.0 / totalSteps);
        if (isLastStep(step, totalSteps) && remaining > 0) {
            load.clear(kind);
        }
        return true;
    }
}
