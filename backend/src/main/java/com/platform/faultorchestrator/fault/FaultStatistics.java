package com.platform.faultorchestrator.fault;

import java.util.Map;

/**
 * Read-only aggregate of registry and success-rate state.
 */
public record FaultStatistics(
    int activeFaultCount,
    int historySize,
    Map<FaultKind, FaultStatus> currentFaults,
    Map<FaultKind, SuccessRate> successRates
) {
    public FaultStatistics {
        currentFaults = Map.copyOf(currentFaults);
        successRates = Map.copyOf(successRates);
    }
    
    public double successRate(FaultKind kind) {
        return successRates.getOrDefault(kind, SuccessRate.NONE).rate();
    }
    
    public long attempts(FaultKind kind) {
        return successRates.getOrDefault(kind, SuccessRate.NONE).attempts();
    }
    
    public long totalAttempts() {
        return successRates.values().stream().mapToLong(SuccessRate::attempts).sum();
    }
    
    public boolean isActive(FaultKind kind) {
        FaultStatus status = currentFaults.get(kind);
        return status != null && status.active();
    }
}
