package com.platform.faultorchestrator.fault;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tracks the last trigger time of each kind and decides whether it may be injected again.
 * 
 * Not thread-safe: {@link FaultRegistry} calls it only while holding its lock, so that the
 * check, the registry insert and the record happen as one step.
 */
public class CooldownGate {
    
    private final FaultCatalog catalog;
    private final Map<FaultKind, Instant> lastTriggered = new EnumMap<>(FaultKind.class);
    
    public CooldownGate(FaultCatalog catalog) {
        this.catalog = catalog;
    }
    
    /**
     * True if the kind was never injected or its cooldown has fully elapsed at {@code now}.
     */
    public boolean check(FaultKind kind, Instant now) {
        return remaining(kind, now).isZero();
    }
    
    /**
     * Time left before the kind may be injected again, zero if it may be injected now.
     */
    public Duration remaining(FaultKind kind, Instant now) {
        Instant last = lastTriggered.get(kind);
        if (last == null) {
            return Duration.ZERO;
        }
        Duration left = catalog.get(kind).cooldown().minus(Duration.between(last, now));
        return left.isNegative() ? Duration.ZERO : left;
    }
    
    public void record(FaultKind kind, Instant now) {
        lastTriggered.put(kind, now);
    }
}
