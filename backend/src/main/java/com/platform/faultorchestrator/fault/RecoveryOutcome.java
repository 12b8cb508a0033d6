package com.platform.faultorchestrator.fault;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Result of one recovery task.
 * 
 * @param stepImprovements mean relative improvement of the affected metrics after each
 *                         executed step, 0.0 where nothing was measurable
 * @param success          true iff every configured step reported success
 */
public record RecoveryOutcome(
    FaultKind kind,
    String faultId,
    Instant startedAt,
    int stepsCompleted,
    int stepsAttempted,
    int configuredSteps,
    List<Double> stepImprovements,
    Duration duration,
    boolean success,
    boolean cancelled
) {
    public RecoveryOutcome {
        stepImprovements = List.copyOf(stepImprovements);
    }
}
