package com.platform.faultorchestrator.fault;

import java.time.Duration;

/**
 * Per-kind view of the registry entry for statistics.
 */
public record FaultStatus(
    boolean active,
    Duration durationSoFar,
    boolean recoveryAttempted,
    Duration effectiveDuration
) {}
