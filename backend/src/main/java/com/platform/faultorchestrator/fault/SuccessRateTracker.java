package com.platform.faultorchestrator.fault;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-kind recovery attempt and success counters.
 * 
 * Not thread-safe; guarded by the {@link FaultRegistry} lock.
 */
public class SuccessRateTracker {
    
    private final Map<FaultKind, SuccessRate> rates = new EnumMap<>(FaultKind.class);
    
    public void record(FaultKind kind, boolean success) {
        SuccessRate current = rates.getOrDefault(kind, SuccessRate.NONE);
        rates.put(kind, new SuccessRate(current.attempts() + 1, current.successes() + (success ? 1 : 0)));
    }
    
    public SuccessRate get(FaultKind kind) {
        return rates.getOrDefault(kind, SuccessRate.NONE);
    }
    
    /**
     * Copy of all counters for kinds with at least one attempt.
     */
    public Map<FaultKind, SuccessRate> snapshot() {
        return rates.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(rates));
    }
}
