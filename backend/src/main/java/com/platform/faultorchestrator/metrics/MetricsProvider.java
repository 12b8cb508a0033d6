package com.platform.faultorchestrator.metrics;

/**
 * Source of system metric snapshots.
 */
@FunctionalInterface
public interface MetricsProvider {
    
    /**
     * Sample the current system metrics.
     * 
     * @return the current reading
     * @throws com.platform.faultorchestrator.error.MetricsUnavailableException if sampling failed
     */
    SystemSnapshot snapshot();
}
