package com.platform.faultorchestrator.fault;

import com.platform.faultorchestrator.error.MetricsUnavailableException;
import com.platform.faultorchestrator.error.RemediationFailedException;
import com.platform.faultorchestrator.metrics.MetricsProvider;
import com.platform.faultorchestrator.metrics.SystemSnapshot;
import com.platform.faultorchestrator.observability.LoggingConfig;
import com.platform.faultorchestrator.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one supervised recovery task per injected fault.
 * 
 * A task executes the kind's fixed step sequence with a delay between steps, measuring
 * metric improvement after each step, then resolves the fault in the registry. Steps run
 * outside the registry lock. Cancellation is cooperative: the active flag is checked once
 * per step boundary.
 */
@Slf4j
public class RecoveryScheduler {
    
    private final FaultCatalog catalog;
    private final FaultRegistry registry;
    private final MetricsProvider metricsProvider;
    private final RemediationAction remediationAction;
    private final ExecutorService executor;
    private final Clock clock;
    private final Duration stepDelay;
    private final MetricsRegistry metricsRegistry;
    
    private final Map<String, Future<?>> tasks = new ConcurrentHashMap<>();
    
    public RecoveryScheduler(
            FaultCatalog catalog,
            FaultRegistry registry,
            MetricsProvider metricsProvider,
            RemediationAction remediationAction,
            ExecutorService executor,
            Clock clock,
            Duration stepDelay,
            MetricsRegistry metricsRegistry) {
        this.catalog = catalog;
        this.registry = registry;
        this.metricsProvider = metricsProvider;
        this.remediationAction = remediationAction;
        this.executor = executor;
        this.clock = clock;
        this.stepDelay = stepDelay;
        this.metricsRegistry = metricsRegistry;
    }
    
    /**
     * Launch the recovery task for a fault without waiting for it.
     * If the executor refuses the task, or the task is cancelled before it starts, the fault
     * is resolved at once as a failed recovery.
     */
    public Optional<Future<?>> schedule(ActiveFault fault) {
        AtomicBoolean started = new AtomicBoolean();
        FutureTask<RecoveryOutcome> task = new FutureTask<RecoveryOutcome>(
                () -> started.compareAndSet(false, true) ? recover(fault) : null) {
            @Override
            protected void done() {
                if (isCancelled() && started.compareAndSet(false, true)) {
                    log.warn("Recovery task for {} cancelled before it started", fault.getKind().getDisplayName());
                    resolveUnstarted(fault);
                }
            }
        };
        tasks.put(fault.getId(), task);
        try {
            executor.execute(task);
            return Optional.of(task);
        } catch (RejectedExecutionException e) {
            log.error("Recovery task for {} rejected by executor", fault.getKind().getDisplayName(), e);
            if (started.compareAndSet(false, true)) {
                resolveUnstarted(fault);
            }
            return Optional.empty();
        }
    }
    
    private void resolveUnstarted(ActiveFault fault) {
        FaultConfig config = catalog.get(fault.getKind());
        complete(fault, new RecoveryOutcome(fault.getKind(), fault.getId(), clock.instant(),
            0, 0, config.recoverySteps(), List.of(), Duration.ZERO, false, true));
    }
    
    /**
     * Body of a recovery task. Never throws.
     */
    RecoveryOutcome recover(ActiveFault fault) {
        FaultKind kind = fault.getKind();
        FaultConfig config = catalog.get(kind);
        int steps = config.recoverySteps();
        Instant start = clock.instant();
        int completed = 0;
        int attempted = 0;
        boolean interrupted = false;
        List<Double> improvements = new ArrayList<>();
        RecoveryOutcome outcome;
        
        LoggingConfig.setFaultContext(kind.getDisplayName(), fault.getId());
        try {
            log.info("Starting recovery for {} ({} steps)", kind.getDisplayName(), steps);
            
            for (int step = 0; step < steps; step++) {
                if (!fault.isActive()) {
                    log.info("Recovery for {} cancelled after {} of {} steps", 
                        kind.getDisplayName(), attempted, steps);
                    break;
                }
                fault.markRecoveryAttempted();
                
                boolean success = executeStep(kind, step);
                attempted++;
                if (success) {
                    completed++;
                }
                metricsRegistry.recordRecoveryStep(kind.getDisplayName(), success);
                
                SystemSnapshot current = captureSnapshot();
                double improvement = improvement(config.metricsAffected(), fault.getInitialSnapshot(), current);
                improvements.add(improvement);
                log.debug("Recovery step {}/{} for {}: success={}, improvement={}", 
                    step + 1, steps, kind.getDisplayName(), success, improvement);
                
                if (step < steps - 1 && !pause()) {
                    interrupted = true;
                    log.warn("Recovery for {} interrupted after {} steps", kind.getDisplayName(), attempted);
                    break;
                }
            }
        } catch (RuntimeException e) {
            log.error("Recovery for {} aborted unexpectedly", kind.getDisplayName(), e);
        } finally {
            Duration duration = Duration.between(start, clock.instant());
            boolean cancelled = interrupted || fault.isCancelled();
            outcome = new RecoveryOutcome(kind, fault.getId(), start, completed, attempted,
                steps, improvements, duration, completed == steps, cancelled);
            complete(fault, outcome);
            LoggingConfig.clearFaultContext();
        }
        return outcome;
    }
    
    private void complete(ActiveFault fault, RecoveryOutcome outcome) {
        registry.resolve(fault, outcome, clock.instant());
        tasks.remove(fault.getId());
        
        metricsRegistry.recordRecoveryCompleted(fault.getKind().getDisplayName(), outcome.success(), outcome.duration());
        metricsRegistry.updateActiveFaults(registry.activeCount());
        
        log.info("Completed recovery for {}, success: {} ({}/{} steps), success rate now {}", 
            fault.getKind().getDisplayName(), outcome.success(), outcome.stepsCompleted(), outcome.configuredSteps(),
            registry.successRate(fault.getKind()).rate());
    }
    
    private boolean executeStep(FaultKind kind, int step) {
        try {
            return remediationAction.remediate(kind, step);
        } catch (RemediationFailedException e) {
            log.warn("{}", e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.warn("Remediation step {} for {} threw", step, kind.getDisplayName(), e);
            return false;
        }
    }
    
    /**
     * Current metrics, or an empty snapshot if the provider fails.
     */
    public SystemSnapshot captureSnapshot() {
        try {
            SystemSnapshot snapshot = metricsProvider.snapshot();
            return snapshot != null ? snapshot : SystemSnapshot.empty(clock.instant());
        } catch (MetricsUnavailableException e) {
            log.warn("Metrics unavailable: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Metrics provider failed", e);
        }
        metricsRegistry.recordMetricsUnavailable();
        return SystemSnapshot.empty(clock.instant());
    }
    
    private boolean pause() {
        if (stepDelay.isZero() || stepDelay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(stepDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
    
    /**
     * Mean relative improvement {@code (initial - current) / initial} over the metrics present in
     * both snapshots that went down. Metrics that did not improve contribute no sample; 0.0 when
     * nothing is measurable.
     */
    static double improvement(Set<String> metrics, SystemSnapshot initial, SystemSnapshot current) {
        double sum = 0.0;
        int samples = 0;
        for (String metric : metrics) {
            Optional<Double> before = initial.value(metric);
            Optional<Double> after = current.value(metric);
            if (before.isPresent() && after.isPresent() && before.get() > after.get()) {
                sum += (before.get() - after.get()) / before.get();
                samples++;
            }
        }
        return samples == 0 ? 0.0 : sum / samples;
    }
    
    public int inFlight() {
        return tasks.size();
    }
    
    /**
     * Wait for every running recovery task.
     * 
     * @return true if all finished within the timeout
     */
    public boolean awaitTermination(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (Future<?> future : List.copyOf(tasks.values())) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return tasks.isEmpty();
            }
            try {
                future.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (CancellationException | ExecutionException e) {
                log.debug("Recovery task ended abnormally: {}", e.getMessage());
            }
        }
        return tasks.isEmpty();
    }
    
    /**
     * Interrupt every running task and cancel queued ones. Either way the fault is resolved.
     */
    public void interruptAll() {
        tasks.values().forEach(future -> future.cancel(true));
    }
}
