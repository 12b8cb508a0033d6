package com.platform.faultorchestrator.fault;

import com.platform.faultorchestrator.error.FaultInjectionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only table of fault configurations, populated once at construction.
 * Kinds absent from the catalog are unknown to the orchestrator.
 */
public final class FaultCatalog {
    
    private final Map<FaultKind, FaultConfig> configs;
    
    private FaultCatalog(Map<FaultKind, FaultConfig> configs) {
        this.configs = configs.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(configs));
    }
    
    public static FaultCatalog of(Map<FaultKind, FaultConfig> configs) {
        return new FaultCatalog(configs);
    }
    
    /**
     * Catalog holding the built-in configuration of every kind.
     */
    public static FaultCatalog defaults() {
        Map<FaultKind, FaultConfig> configs = new EnumMap<>(FaultKind.class);
        for (FaultKind kind : FaultKind.values()) {
            configs.put(kind, FaultConfig.defaultsFor(kind));
        }
        return new FaultCatalog(configs);
    }
    
    public Optional<FaultConfig> find(FaultKind kind) {
        return Optional.ofNullable(configs.get(kind));
    }
    
    /**
     * @throws FaultInjectionException with UNKNOWN_FAULT_KIND if the kind is not catalogued
     */
    public FaultConfig get(FaultKind kind) {
        return find(kind).orElseThrow(() -> FaultInjectionException.unknownKind(kind.getDisplayName()));
    }
    
    /**
     * Catalogued kinds in declaration order.
     */
    public Set<FaultKind> kinds() {
        return configs.keySet();
    }
    
    public Map<FaultKind, FaultConfig> entries() {
        return configs;
    }
}
