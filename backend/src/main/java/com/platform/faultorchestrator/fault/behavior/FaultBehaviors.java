package com.platform.faultorchestrator.fault.behavior;

import com.platform.faultorchestrator.error.RemediationFailedException;
import com.platform.faultorchestrator.fault.FaultCatalog;
import com.platform.faultorchestrator.fault.FaultConfig;
import com.platform.faultorchestrator.fault.FaultKind;
import com.platform.faultorchestrator.fault.FaultSimulator;
import com.platform.faultorchestrator.fault.RemediationAction;
import com.platform.faultorchestrator.metrics.SyntheticLoad;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;

/**
 * Synthetic simulator and remediation backed by one {@link FaultBehavior} per catalogued kind.
 */
@Slf4j
public class FaultBehaviors implements FaultSimulator, RemediationAction {
    
    private final Map<FaultKind, FaultBehavior> behaviors = new EnumMap<>(FaultKind.class);
    
    public FaultBehaviors(FaultCatalog catalog, SyntheticLoad load) {
        catalog.entries().forEach((kind, config) -> behaviors.put(kind, behaviorFor(kind, config, load)));
    }
    
    static FaultBehavior behaviorFor(FaultKind kind, FaultConfig config, SyntheticLoad load) {
        return switch (kind) {
            case CPU_OVERLOAD -> new CpuOverloadBehavior(config, load);
            case MEMORY_LEAK -> new MemoryLeakBehavior(config, load);
            case DISK_FILL -> new DiskFillBehavior(config, load);
            case IO_STRESS -> new IoStressBehavior(config, load);
        };
    }
    
    @Override
    public void simulate(FaultKind kind) {
        FaultBehavior behavior = behaviors.get(kind);
        if (behavior == null) {
            log.warn("No behavior registered for {}", kind.getDisplayName());
            return;
        }
        behavior.simulate();
    }
    
    @Override
    public boolean remediate(FaultKind kind, int step) {
        FaultBehavior behavior = behaviors.get(kind);
        if (behavior == null) {
            throw new RemediationFailedException(kind.getDisplayName(), step, "no behavior registered");
        }
        return behavior.recover(step);
    }
}
