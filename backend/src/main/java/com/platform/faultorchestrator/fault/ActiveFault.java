package com.platform.faultorchestrator.fault;

import com.platform.faultorchestrator.metrics.SystemSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A fault created by an accepted injection.
 * 
 * Only its own recovery task advances it; an external caller may clear the active flag
 * to cancel recovery cooperatively. Once resolved it stays in the registry as a record
 * until the next injection of the same kind replaces it.
 */
public class ActiveFault {
    
    private final String id;
    private final FaultKind kind;
    private final Instant startedAt;
    private final Duration effectiveDuration;
    private final int cascadeDepth;
    
    private final AtomicBoolean active = new AtomicBoolean(true);
    private volatile boolean cancelled;
    private volatile boolean recoveryAttempted;
    private volatile SystemSnapshot initialSnapshot;
    private volatile RecoveryOutcome outcome;
    private volatile Instant endedAt;
    
    public ActiveFault(FaultKind kind, Instant startedAt, Duration effectiveDuration, int cascadeDepth) {
        this.id = UUID.randomUUID().toString();
        this.kind = kind;
        this.startedAt = startedAt;
        this.effectiveDuration = effectiveDuration;
        this.cascadeDepth = cascadeDepth;
        this.initialSnapshot = SystemSnapshot.empty(startedAt);
    }
    
    public String getId() {
        return id;
    }
    
    public FaultKind getKind() {
        return kind;
    }
    
    public Instant getStartedAt() {
        return startedAt;
    }
    
    public Duration getEffectiveDuration() {
        return effectiveDuration;
    }
    
    public int getCascadeDepth() {
        return cascadeDepth;
    }
    
    public boolean isActive() {
        return active.get();
    }
    
    public boolean isCancelled() {
        return cancelled;
    }
    
    public boolean isRecoveryAttempted() {
        return recoveryAttempted;
    }
    
    public SystemSnapshot getInitialSnapshot() {
        return initialSnapshot;
    }
    
    public Optional<RecoveryOutcome> getOutcome() {
        return Optional.ofNullable(outcome);
    }
    
    public Optional<Instant> getEndedAt() {
        return Optional.ofNullable(endedAt);
    }
    
    /**
     * Time since injection, frozen at resolution once the fault has ended.
     */
    public Duration durationAt(Instant now) {
        Instant end = endedAt != null ? endedAt : now;
        Duration elapsed = Duration.between(startedAt, end);
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }
    
    /**
     * Clear the active flag from outside the recovery task.
     * 
     * @return true if the fault was active and is now cancelled
     */
    public boolean cancel() {
        if (active.compareAndSet(true, false)) {
            cancelled = true;
            return true;
        }
        return false;
    }
    
    void captureInitialState(SystemSnapshot snapshot) {
        this.initialSnapshot = snapshot;
    }
    
    void markRecoveryAttempted() {
        this.recoveryAttempted = true;
    }
    
    void resolve(RecoveryOutcome outcome, Instant endedAt) {
        this.outcome = outcome;
        this.endedAt = endedAt;
        active.set(false);
    }
    
    @Override
    public String toString() {
        return String.format("ActiveFault[%s %s active=%s]", kind.getDisplayName(), id, active.get());
    }
}
