package com.platform.faultorchestrator.metrics;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Point-in-time reading of monitored system metrics, as percentages.
 * A snapshot may be empty when sampling failed.
 */
public record SystemSnapshot(
    Map<String, Double> values,
    Instant timestamp
) {
    public static final String CPU_USAGE = "cpu_usage";
    public static final String MEMORY_USAGE = "memory_usage";
    public static final String DISK_USAGE = "disk_usage";
    
    public SystemSnapshot {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
    
    public static SystemSnapshot empty(Instant timestamp) {
        return new SystemSnapshot(Map.of(), timestamp);
    }
    
    public static SystemSnapshot of(double cpuUsage, double memoryUsage, double diskUsage, Instant timestamp) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(CPU_USAGE, cpuUsage);
        values.put(MEMORY_USAGE, memoryUsage);
        values.put(DISK_USAGE, diskUsage);
        return new SystemSnapshot(values, timestamp);
    }
    
    public Optional<Double> value(String metric) {
        return Optional.ofNullable(values.get(metric));
    }
    
    public boolean isEmpty() {
        return values.isEmpty();
    }
}
