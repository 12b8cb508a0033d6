package com.platform.faultorchestrator.fault.behavior;

import com.platform.faultorchestrator.error.RemediationFailedException;
import com.platform.faultorchestrator.fault.FaultConfig;
import com.platform.faultorchestrator.fault.FaultKind;
import com.platform.faultorchestrator.metrics.SyntheticLoad;

/**
 * Base for behaviors that perturb the shared synthetic load.
 */
abstract class AbstractFaultBehavior implements FaultBehavior {
    
    protected final FaultKind kind;
    protected final FaultConfig config;
    protected final SyntheticLoad load;
    
    protected AbstractFaultBehavior(FaultKind kind, FaultConfig config, SyntheticLoad load) {
        this.kind = kind;
        this.config = config;
        this.load = load;
    }
    
    @Override
    public void simulate() {
        load.perturb(kind, config.metricsAffected(), config.impactFactor());
    }
    
    @Override
    public final boolean recover(int step) {
        if (step < 0 || step >= config.recoverySteps()) {
            throw new RemediationFailedException(kind.getDisplayName(), step, "no such recovery step");
        }
        return relieve(step, config.recoverySteps());
    }
    
    protected abstract boolean relieve(int step, int totalSteps);
    
    protected boolean isLastStep(int step, int totalSteps) {
        return step == totalSteps - 1;
    }
}
