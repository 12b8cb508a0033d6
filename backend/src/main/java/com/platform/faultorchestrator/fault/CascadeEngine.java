package com.platform.faultorchestrator.fault;

import com.platform.faultorchestrator.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleSupplier;

/**
 * Probabilistic secondary injections triggered by a primary injection.
 * 
 * Secondary injections re-enter the injector and pass the same catalog, cooldown and
 * depth checks as any other request; rejected ones are dropped.
 */
@Slf4j
public class CascadeEngine {
    
    private final FaultCatalog catalog;
    private final DoubleSupplier random;
    private final CascadeProbabilitySource probabilitySource;
    private final CascadeInjector injector;
    private final MetricsRegistry metricsRegistry;
    
    public CascadeEngine(
            FaultCatalog catalog,
            DoubleSupplier random,
            CascadeProbabilitySource probabilitySource,
            CascadeInjector injector,
            MetricsRegistry metricsRegistry) {
        this.catalog = catalog;
        this.random = random;
        this.probabilitySource = probabilitySource;
        this.injector = injector;
        this.metricsRegistry = metricsRegistry;
    }
    
    /**
     * Draw whether an accepted injection of {@code primary} cascades at all.
     */
    public boolean shouldCascade(FaultKind primary) {
        return random.getAsDouble() < catalog.get(primary).cascadeProbability();
    }
    
    /**
     * Attempt a secondary injection of every other catalogued kind.
     * 
     * @param depth cascade depth of the primary injection
     * @return results of the secondary injections that were attempted
     */
    public List<InjectionResult> cascade(FaultKind primary, int depth) {
        List<InjectionResult> results = new ArrayList<>();
        double primaryProbability = catalog.get(primary).cascadeProbability();
        
        for (FaultKind target : catalog.kinds()) {
            if (target == primary) {
                continue;
            }
            FaultConfig targetConfig = catalog.get(target);
            double probability = probabilitySource == CascadeProbabilitySource.PRIMARY
                ? primaryProbability
                : targetConfig.cascadeProbability();
            
            if (random.getAsDouble() >= probability) {
                continue;
            }
            
            InjectionResult result = injector.inject(target, targetConfig.cascadeDuration(), depth + 1);
            results.add(result);
            
            if (result.accepted()) {
                metricsRegistry.recordCascadeTriggered(primary.getDisplayName(), target.getDisplayName());
                log.warn("Cascade effect triggered: {} from primary fault: {} (depth {})", 
                    target.getDisplayName(), primary.getDisplayName(), depth + 1);
            } else {
                log.debug("Cascade {} -> {} dropped: {}", 
                    primary.getDisplayName(), target.getDisplayName(), result.reason());
            }
        }
        return results;
    }
}
