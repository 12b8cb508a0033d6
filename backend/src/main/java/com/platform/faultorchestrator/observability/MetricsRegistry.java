package com.platform.faultorchestrator.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Central registry for orchestrator metrics.
 * Provides methods for recording injections, cascades and recovery outcomes.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final AtomicInteger activeFaults;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        this.activeFaults = new AtomicInteger(0);
        
        Gauge.builder("faultorchestrator.faults.active", activeFaults, AtomicInteger::get)
            .description("Number of faults currently active")
            .register(meterRegistry);
        
        log.info("Metrics registry initialized");
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
    
    /**
     * Record an accepted injection. Origin is "direct" or "cascade".
     */
    public void recordFaultInjected(String faultKind, boolean cascaded) {
        incrementCounter("faultorchestrator.faults.injected", 
            "kind", faultKind, "origin", cascaded ? "cascade" : "direct");
        log.debug("Recorded fault injected: {} (cascade: {})", faultKind, cascaded);
    }
    
    /**
     * Record a rejected injection.
     */
    public void recordInjectionRejected(String faultKind, String reasonCode) {
        incrementCounter("faultorchestrator.faults.rejected", 
            "kind", faultKind, "reason", reasonCode);
    }
    
    public void recordCascadeTriggered(String sourceKind, String targetKind) {
        incrementCounter("faultorchestrator.cascade.triggered", 
            "source", sourceKind, "target", targetKind);
    }
    
    public void recordRecoveryStep(String faultKind, boolean success) {
        incrementCounter("faultorchestrator.recovery.steps", 
            "kind", faultKind, "success", String.valueOf(success));
    }
    
    /**
     * Record a resolved recovery task and how long it ran.
     */
    public void recordRecoveryCompleted(String faultKind, boolean success, Duration duration) {
        incrementCounter("faultorchestrator.recovery.completed", 
            "kind", faultKind, "success", String.valueOf(success));
        timers.computeIfAbsent(faultKind, k -> 
            Timer.builder("faultorchestrator.recovery.duration")
                .tag("kind", faultKind)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry))
            .record(duration);
        log.debug("Recorded recovery completed: {} after {}ms (success: {})", 
            faultKind, duration.toMillis(), success);
    }
    
    public void recordMetricsUnavailable() {
        incrementCounter("faultorchestrator.metrics.unavailable");
    }
    
    public void updateActiveFaults(int count) {
        activeFaults.set(count);
    }
    
    public int getActiveFaults() {
        return activeFaults.get();
    }
    
    /**
     * Current value of a counter, 0 if it was never incremented.
     */
    public double getCounterValue(String name, String... tags) {
        Counter counter = counters.get(name + String.join(".", tags));
        return counter != null ? counter.count() : 0.0;
    }
}
