package com.platform.faultorchestrator.fault;

import java.time.Duration;

/**
 * Re-entry point used by the cascade engine to inject secondary faults.
 */
@FunctionalInterface
public interface CascadeInjector {
    
    InjectionResult inject(FaultKind kind, Duration requestedDuration, int cascadeDepth);
}
