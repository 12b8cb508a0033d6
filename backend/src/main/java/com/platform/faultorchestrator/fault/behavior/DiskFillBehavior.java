package com.platform.faultorchestrator.fault.behavior;

import com.platform.faultorchestrator.fault.FaultConfig;
import com.platform.faultorchestrator.fault.FaultKind;
import com.platform.faultorchestrator.metrics.SyntheticLoad;

/**
 * The first step only locates reclaimable files; later steps free space in equal slices.
 */
class DiskFillBehavior extends AbstractFaultBehavior {
    
    DiskFillBehavior(FaultConfig config, SyntheticLoad load) {
        super(FaultKind.DISK_FILL, config, load);
    }
    
    @Override
    protected boolean relieve(int step, int totalSteps) {
        if (isLastStep(step, totalSteps)) {
            load.clear(kind);
        } else if (step > 0) {
            load.relieve(kind, 1.0 / (totalSteps - 1));
        }
        return true;
    }
}
