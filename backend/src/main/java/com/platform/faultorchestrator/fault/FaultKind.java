package com.platform.faultorchestrator.fault;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of synthetic failure categories the orchestrator can inject.
 * 
 * Adding a kind means adding a default configuration in {@link FaultConfig#defaultsFor}
 * and a behavior in {@link com.platform.faultorchestrator.fault.behavior.FaultBehaviors};
 * both dispatch with exhaustive switches, so the compiler points at every site.
 */
public enum FaultKind {
    /**
     * Sustained CPU saturation.
     */
    CPU_OVERLOAD("CPUOverload"),
    
    /**
     * Steadily growing memory usage.
     */
    MEMORY_LEAK("MemoryLeak"),
    
    /**
     * Disk space exhaustion.
     */
    DISK_FILL("DiskFill"),
    
    /**
     * Heavy I/O contention, visible on both disk and CPU.
     */
    IO_STRESS("IOStress");
    
    private final String displayName;
    
    FaultKind(String displayName) {
        this.displayName = displayName;
    }
    
    public String getDisplayName() {
        return displayName;
    }
    
    /**
     * Resolve a kind from a user-supplied name.
     * Accepts {@code CPUOverload}, {@code cpu_overload}, {@code CPU_OVERLOAD} or {@code cpu-overload}.
     */
    public static Optional<FaultKind> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(name);
        for (FaultKind kind : values()) {
            if (normalize(kind.name()).equals(normalized) || normalize(kind.displayName).equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
    
    private static String normalize(String name) {
        return name.replaceAll("[_\\-\\s]", "").toLowerCase(Locale.ROOT);
    }
}
