package com.platform.faultorchestrator.fault;

import com.platform.faultorchestrator.error.FaultInjectionException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Kind to fault mapping plus the bounded recovery history.
 * 
 * A single lock guards the fault map, the cooldown gate and the success-rate counters.
 * Critical sections are short; no collaborator is called while it is held.
 */
@Slf4j
public class FaultRegistry {
    
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<FaultKind, ActiveFault> faults = new EnumMap<>(FaultKind.class);
    private final Deque<RecoveryOutcome> history = new ArrayDeque<>();
    private final CooldownGate cooldownGate;
    private final SuccessRateTracker successRates;
    private final int historySize;
    
    public FaultRegistry(CooldownGate cooldownGate, SuccessRateTracker successRates, int historySize) {
        if (historySize < 1) {
            throw new IllegalArgumentException("historySize must be at least 1");
        }
        this.cooldownGate = cooldownGate;
        this.successRates = successRates;
        this.historySize = historySize;
    }
    
    /**
     * Check the cooldown, insert a new fault and record the trigger time in one step.
     * 
     * @throws FaultInjectionException with FAULT_IN_COOLDOWN if the kind may not be injected yet
     */
    public ActiveFault admit(FaultKind kind, Duration effectiveDuration, int cascadeDepth, Instant now) {
        lock.lock();
        try {
            if (!cooldownGate.check(kind, now)) {
                throw FaultInjectionException.inCooldown(kind.getDisplayName(), cooldownGate.remaining(kind, now));
            }
            
            ActiveFault fault = new ActiveFault(kind, now, effectiveDuration, cascadeDepth);
            ActiveFault previous = faults.put(kind, fault);
            cooldownGate.record(kind, now);
            
            if (previous != null && previous.isActive()) {
                // cooldown shorter than the previous fault's recovery; that task keeps running
                log.warn("Fault {} superseded while still recovering ({})", kind.getDisplayName(), previous.getId());
            }
            return fault;
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Finish a fault: mark it inactive, append the outcome to history and count the attempt.
     */
    public void resolve(ActiveFault fault, RecoveryOutcome outcome, Instant now) {
        lock.lock();
        try {
            fault.resolve(outcome, now);
            history.addLast(outcome);
            while (history.size() > historySize) {
                history.removeFirst();
            }
            successRates.record(fault.getKind(), outcome.success());
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Cancel the current fault of a kind.
     * 
     * @return false if there is no active fault of that kind
     */
    public boolean cancel(FaultKind kind) {
        lock.lock();
        try {
            ActiveFault fault = faults.get(kind);
            return fault != null && fault.cancel();
        } finally {
            lock.unlock();
        }
    }
    
    public Optional<ActiveFault> current(FaultKind kind) {
        lock.lock();
        try {
            return Optional.ofNullable(faults.get(kind));
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Active flag of every registered kind, in declaration order.
     */
    public Map<FaultKind, Boolean> activeFlags() {
        lock.lock();
        try {
            Map<FaultKind, Boolean> flags = new EnumMap<>(FaultKind.class);
            faults.forEach((kind, fault) -> flags.put(kind, fault.isActive()));
            return flags;
        } finally {
            lock.unlock();
        }
    }
    
    public List<ActiveFault> activeFaults() {
        lock.lock();
        try {
            return faults.values().stream().filter(ActiveFault::isActive).toList();
        } finally {
            lock.unlock();
        }
    }
    
    public int activeCount() {
        lock.lock();
        try {
            return (int) faults.values().stream().filter(ActiveFault::isActive).count();
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Recovery outcomes, oldest first.
     */
    public List<RecoveryOutcome> history() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }
    
    public SuccessRate successRate(FaultKind kind) {
        lock.lock();
        try {
            return successRates.get(kind);
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Consistent copy of everything the statistics need, taken under one lock acquisition.
     */
    public RegistryView view() {
        lock.lock();
        try {
            return new RegistryView(
                List.copyOf(faults.values()),
                successRates.snapshot(),
                history.size());
        } finally {
            lock.unlock();
        }
    }
    
    public record RegistryView(
        List<ActiveFault> faults,
        Map<FaultKind, SuccessRate> successRates,
        int historySize
    ) {}
}
