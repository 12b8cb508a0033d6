package com.platform.faultorchestrator.metrics;

import com.platform.faultorchestrator.fault.FaultKind;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Overlay of synthetic metric perturbations caused by injected faults.
 * 
 * Each perturbed kind inflates its affected metrics by
 * {@code 1 + (impactFactor - 1) * remaining}, where {@code remaining} starts at 1.0
 * and is drained by recovery steps. Perturbed values are capped at 100%.
 */
@Slf4j
public class SyntheticLoad {
    
    private static final double MAX_PERCENT = 100.0;
    
    private final Map<FaultKind, Perturbation> perturbations = new ConcurrentHashMap<>();
    
    /**
     * Start (or restart) the perturbation for a fault kind at full strength.
     */
    public void perturb(FaultKind kind, Set<String> metrics, double impactFactor) {
        perturbations.put(kind, new Perturbation(Set.copyOf(metrics), impactFactor, 1.0));
        log.debug("Synthetic load applied for {} on {} (impact {})", kind, metrics, impactFactor);
    }
    
    /**
     * Drain part of a kind's perturbation.
     * 
     * @return the remaining strength, 0 once fully relieved
     */
    public double relieve(FaultKind kind, double fraction) {
        Perturbation updated = perturbations.computeIfPresent(kind, (k, p) -> {
            double remaining = p.remaining() - fraction;
            return remaining <= 1e-9 ? null : new Perturbation(p.metrics(), p.impactFactor(), remaining);
        });
        return updated != null ? updated.remaining() : 0.0;
    }
    
    /**
     * Scale a kind's remaining strength, e.g. 0.5 halves it.
     */
    public double scale(FaultKind kind, double factor) {
        Perturbation updated = perturbations.computeIfPresent(kind, (k, p) ->
            new Perturbation(p.metrics(), p.impactFactor(), p.remaining() * factor));
        return updated != null ? updated.remaining() : 0.0;
    }
    
    public void clear(FaultKind kind) {
        perturbations.remove(kind);
    }
    
    public double remaining(FaultKind kind) {
        Perturbation p = perturbations.get(kind);
        return p != null ? p.remaining() : 0.0;
    }
    
    /**
     * Combined multiplier for a metric across all perturbations touching it.
     */
    public double multiplier(String metric) {
        double multiplier = 1.0;
        for (Perturbation p : perturbations.values()) {
            if (p.metrics().contains(metric)) {
                multiplier *= 1.0 + (p.impactFactor() - 1.0) * p.remaining();
            }
        }
        return multiplier;
    }
    
    /**
     * Apply the overlay to a base reading.
     */
    public SystemSnapshot apply(SystemSnapshot base) {
        if (perturbations.isEmpty() || base.isEmpty()) {
            return base;
        }
        Map<String, Double> values = new LinkedHashMap<>();
        base.values().forEach((metric, value) ->
            values.put(metric, Math.min(MAX_PERCENT, value * multiplier(metric))));
        return new SystemSnapshot(values, base.timestamp());
    }
    
    private record Perturbation(Set<String> metrics, double impactFactor, double remaining) {}
}
