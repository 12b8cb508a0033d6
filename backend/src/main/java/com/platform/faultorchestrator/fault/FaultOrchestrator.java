package com.platform.faultorchestrator.fault;

import com.platform.faultorchestrator.error.FaultInjectionException;
import com.platform.faultorchestrator.metrics.MetricsProvider;
import com.platform.faultorchestrator.observability.LoggingConfig;
import com.platform.faultorchestrator.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.DoubleSupplier;

/**
 * Fault injection and recovery orchestrator.
 * 
 * Injection flow: catalog check, cooldown check and registry insert (atomically),
 * synthetic effect, initial snapshot, recovery task launch, then a probabilistic cascade
 * that re-enters {@link #inject(FaultKind, Duration, int)} with a deeper cascade depth.
 * One instance owns all fault state for its lifetime.
 */
@Slf4j
public class FaultOrchestrator {
    
    private final FaultCatalog catalog;
    private final FaultRegistry registry;
    private final RecoveryScheduler recoveryScheduler;
    private final CascadeEngine cascadeEngine;
    private final StatisticsReporter statisticsReporter;
    private final FaultSimulator simulator;
    private final Clock clock;
    private final OrchestratorSettings settings;
    private final MetricsRegistry metricsRegistry;
    
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    
    public FaultOrchestrator(
            FaultCatalog catalog,
            MetricsProvider metricsProvider,
            FaultSimulator simulator,
            RemediationAction remediationAction,
            ExecutorService recoveryExecutor,
            Clock clock,
            DoubleSupplier random,
            OrchestratorSettings settings,
            MetricsRegistry metricsRegistry) {
        this.catalog = catalog;
        this.simulator = simulator;
        this.clock = clock;
        this.settings = settings;
        this.metricsRegistry = metricsRegistry;
        this.registry = new FaultRegistry(new CooldownGate(catalog), new SuccessRateTracker(), settings.historySize());
        this.recoveryScheduler = new RecoveryScheduler(catalog, registry, metricsProvider, remediationAction,
            recoveryExecutor, clock, settings.stepDelay(), metricsRegistry);
        this.cascadeEngine = new CascadeEngine(catalog, random, settings.cascadeProbabilitySource(),
            this::inject, metricsRegistry);
        this.statisticsReporter = new StatisticsReporter(registry, clock);
        
        log.info("Fault orchestrator initialized: kinds={}, stepDelay={}, maxCascadeDepth={}", 
            catalog.kinds(), settings.stepDelay(), settings.maxCascadeDepth());
    }
    
    // ==================== Injection ====================
    
    /**
     * Inject a fault for its maximum duration.
     */
    public boolean injectFault(FaultKind kind) {
        return inject(kind, null).accepted();
    }
    
    /**
     * Inject a fault.
     * 
     * @param requestedDuration desired duration, clamped to the kind's maximum; {@code null} for the maximum
     * @return true if the injection was accepted
     */
    public boolean injectFault(FaultKind kind, Duration requestedDuration) {
        return inject(kind, requestedDuration).accepted();
    }
    
    public boolean injectFault(String kindName, Duration requestedDuration) {
        return inject(kindName, requestedDuration).accepted();
    }
    
    /**
     * Inject a fault by name; names matching no kind are rejected as unknown.
     */
    public InjectionResult inject(String kindName, Duration requestedDuration) {
        Optional<FaultKind> kind = FaultKind.fromName(kindName);
        if (kind.isEmpty()) {
            FaultInjectionException rejection = FaultInjectionException.unknownKind(kindName);
            log.info("Rejected injection: {}", rejection.getMessage());
            metricsRegistry.recordInjectionRejected(String.valueOf(kindName), rejection.getErrorCode().getCode());
            return InjectionResult.rejected(null, kindName, rejection, 0);
        }
        return inject(kind.get(), requestedDuration);
    }
    
    public InjectionResult inject(FaultKind kind, Duration requestedDuration) {
        return inject(kind, requestedDuration, 0);
    }
    
    InjectionResult inject(FaultKind kind, Duration requestedDuration, int cascadeDepth) {
        String name = kind.getDisplayName();
        try {
            if (shuttingDown.get()) {
                throw FaultInjectionException.shuttingDown(name);
            }
            FaultConfig config = catalog.get(kind);
            if (!settings.isCascadeDepthAllowed(cascadeDepth)) {
                throw FaultInjectionException.cascadeDepthExhausted(name, cascadeDepth, settings.maxCascadeDepth());
            }
            Duration effectiveDuration = config.effectiveDuration(kind, requestedDuration);
            
            ActiveFault fault = registry.admit(kind, effectiveDuration, cascadeDepth, clock.instant());
            LoggingConfig.setFaultContext(name, fault.getId());
            try {
                log.info("Injecting fault: {}, duration: {}s, impact_factor: {}, depth: {}", 
                    name, effectiveDuration.toSeconds(), config.impactFactor(), cascadeDepth);
                
                applySimulation(kind);
                fault.captureInitialState(recoveryScheduler.captureSnapshot());
                recoveryScheduler.schedule(fault);
                
                metricsRegistry.recordFaultInjected(name, cascadeDepth > 0);
                metricsRegistry.updateActiveFaults(registry.activeCount());
            } finally {
                LoggingConfig.clearFaultContext();
            }
            
            if (cascadeEngine.shouldCascade(kind)) {
                cascadeEngine.cascade(kind, cascadeDepth);
            }
            
            return InjectionResult.accepted(kind, effectiveDuration, cascadeDepth);
            
        } catch (FaultInjectionException e) {
            if (cascadeDepth == 0) {
                log.info("Rejected injection of {}: {}", name, e.getMessage());
            } else {
                log.debug("Rejected cascade injection of {}: {}", name, e.getMessage());
            }
            metricsRegistry.recordInjectionRejected(name, e.getErrorCode().getCode());
            return InjectionResult.rejected(kind, name, e, cascadeDepth);
        }
    }
    
    private void applySimulation(FaultKind kind) {
        try {
            simulator.simulate(kind);
        } catch (RuntimeException e) {
            log.warn("Simulation of {} failed; recovery proceeds against unperturbed metrics", 
                kind.getDisplayName(), e);
        }
    }
    
    // ==================== Control ====================
    
    /**
     * Cooperatively cancel the active fault of a kind. Its recovery task stops at the next step boundary.
     * 
     * @return false if no fault of that kind is active
     */
    public boolean cancelFault(FaultKind kind) {
        boolean cancelled = registry.cancel(kind);
        if (cancelled) {
            log.info("Cancelled fault {}", kind.getDisplayName());
        }
        return cancelled;
    }
    
    /**
     * Stop accepting injections, cancel every active fault and wait for recovery tasks.
     * Tasks still running after the timeout are interrupted.
     * 
     * @return true if every task finished within the timeout
     */
    public boolean shutdown(Duration timeout) {
        if (!shuttingDown.compareAndSet(false, true)) {
            return recoveryScheduler.inFlight() == 0;
        }
        List<ActiveFault> active = registry.activeFaults();
        log.info("Shutting down fault orchestrator: cancelling {} active faults", active.size());
        active.forEach(fault -> registry.cancel(fault.getKind()));
        
        boolean drained = recoveryScheduler.awaitTermination(timeout);
        if (!drained) {
            log.warn("Recovery tasks still running after {}, interrupting", timeout);
            recoveryScheduler.interruptAll();
        }
        return drained;
    }
    
    public boolean isShuttingDown() {
        return shuttingDown.get();
    }
    
    /**
     * Wait until no recovery task is running.
     */
    public boolean awaitRecoveries(Duration timeout) {
        return recoveryScheduler.awaitTermination(timeout);
    }
    
    // ==================== Queries ====================
    
    /**
     * Active flag of every registered kind.
     */
    public Map<FaultKind, Boolean> getActiveFaults() {
        return registry.activeFlags();
    }
    
    public FaultStatistics getFaultStatistics() {
        return statisticsReporter.report();
    }
    
    /**
     * "Recovering from &lt;kind&gt;" or "Monitoring &lt;kind&gt;" for each active fault.
     */
    public List<String> getRecoveryStatus() {
        return statisticsReporter.recoveryStatus();
    }
    
    public List<RecoveryOutcome> getRecoveryHistory() {
        return registry.history();
    }
    
    public Optional<ActiveFault> findFault(FaultKind kind) {
        return registry.current(kind);
    }
    
    public FaultCatalog getCatalog() {
        return catalog;
    }
}
