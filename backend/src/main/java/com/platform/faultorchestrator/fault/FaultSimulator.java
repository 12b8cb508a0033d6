package com.platform.faultorchestrator.fault;

/**
 * Applies the synthetic effect of a freshly injected fault.
 */
@FunctionalInterface
public interface FaultSimulator {
    
    FaultSimulator NONE = kind -> { };
    
    void simulate(FaultKind kind);
}
