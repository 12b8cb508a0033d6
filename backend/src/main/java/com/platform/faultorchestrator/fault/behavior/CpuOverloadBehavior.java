package com.platform.faultorchestrator.fault.behavior;

import com.platform.faultorchestrator.fault.FaultConfig;
import com.platform.faultorchestrator.fault.FaultKind;
import com.platform.faultorchestrator.metrics.SyntheticLoad;

/**
 * Sheds CPU load in equal slices, one per step.
 */
class CpuOverloadBehavior extends AbstractFaultBehavior {
    
    CpuOverloadBehavior(FaultConfig config, SyntheticLoad load) {
        super(FaultKind.CPU_OVERLOAD, config, load);
    }
    
    @Override
    protected boolean relieve(int step, int totalSteps) {
        if (isLastStep(step, totalSteps)) {
            load.clear(kind);
        } else {
            load.relieve(kind, 1.0 / totalSteps);
        }
        return true;
    }
}
