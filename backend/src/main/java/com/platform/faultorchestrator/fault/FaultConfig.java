package com.platform.faultorchestrator.fault;

import com.platform.faultorchestrator.error.FaultInjectionException;
import com.platform.faultorchestrator.error.ValidationException;
import com.platform.faultorchestrator.metrics.SystemSnapshot;
import lombok.Builder;

import java.time.Duration;
import java.util.Set;

/**
 * Immutable per-kind fault configuration.
 */
@Builder(toBuilder = true)
public record FaultConfig(
    double impactFactor,
    int recoverySteps,
    Set<String> metricsAffected,
    Duration cooldown,
    Duration maxDuration,
    double cascadeProbability
) {
    public FaultConfig {
        if (recoverySteps < 1) {
            throw new ValidationException("recoverySteps", recoverySteps, "must be at least 1");
        }
        if (cascadeProbability < 0.0 || cascadeProbability > 1.0) {
            throw new ValidationException("cascadeProbability", cascadeProbability, "must be within [0, 1]");
        }
        if (cooldown == null || cooldown.isNegative()) {
            throw new ValidationException("cooldown", cooldown, "must be zero or positive");
        }
        if (maxDuration == null || maxDuration.isZero() || maxDuration.isNegative()) {
            throw new ValidationException("maxDuration", maxDuration, "must be positive");
        }
        metricsAffected = metricsAffected == null ? Set.of() : Set.copyOf(metricsAffected);
    }
    
    /**
     * Built-in configuration for a kind.
     */
    public static FaultConfig defaultsFor(FaultKind kind) {
        return switch (kind) {
            case CPU_OVERLOAD -> new FaultConfig(1.5, 5, Set.of(SystemSnapshot.CPU_USAGE),
                Duration.ofSeconds(300), Duration.ofSeconds(60), 0.3);
            case MEMORY_LEAK -> new FaultConfig(1.3, 4, Set.of(SystemSnapshot.MEMORY_USAGE),
                Duration.ofSeconds(400), Duration.ofSeconds(45), 0.25);
            case DISK_FILL -> new FaultConfig(1.2, 3, Set.of(SystemSnapshot.DISK_USAGE),
                Duration.ofSeconds(500), Duration.ofSeconds(30), 0.2);
            case IO_STRESS -> new FaultConfig(1.4, 4, Set.of(SystemSnapshot.DISK_USAGE, SystemSnapshot.CPU_USAGE),
                Duration.ofSeconds(350), Duration.ofSeconds(40), 0.35);
        };
    }
    
    /**
     * Clamp a requested duration to {@link #maxDuration}; {@code null} means the maximum.
     * 
     * @throws FaultInjectionException if the request is zero or negative
     */
    public Duration effectiveDuration(FaultKind kind, Duration requested) {
        if (requested == null) {
            return maxDuration;
        }
        if (requested.isZero() || requested.isNegative()) {
            throw FaultInjectionException.invalidDuration(kind.getDisplayName(), requested);
        }
        return requested.compareTo(maxDuration) > 0 ? maxDuration : requested;
    }
    
    /**
     * Duration requested for this kind when it is injected as a cascade: half the maximum, rounded up.
     */
    public Duration cascadeDuration() {
        long seconds = maxDuration.toSeconds();
        return Duration.ofSeconds(Math.max(1, (seconds + 1) / 2));
    }
}
