package com.platform.faultorchestrator.fault;

import lombok.Builder;

import java.time.Duration;

/**
 * Tuning knobs of the orchestrator.
 * 
 * @param maxCascadeDepth deepest cascade level accepted; negative for no limit
 */
@Builder(toBuilder = true)
public record OrchestratorSettings(
    Duration stepDelay,
    int historySize,
    int maxCascadeDepth,
    CascadeProbabilitySource cascadeProbabilitySource
) {
    public static final Duration DEFAULT_STEP_DELAY = Duration.ofSeconds(2);
    public static final int DEFAULT_HISTORY_SIZE = 100;
    public static final int DEFAULT_MAX_CASCADE_DEPTH = 3;
    
    public OrchestratorSettings {
        stepDelay = stepDelay != null ? stepDelay : DEFAULT_STEP_DELAY;
        cascadeProbabilitySource = cascadeProbabilitySource != null 
            ? cascadeProbabilitySource 
            : CascadeProbabilitySource.PRIMARY;
    }
    
    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(DEFAULT_STEP_DELAY, DEFAULT_HISTORY_SIZE, 
            DEFAULT_MAX_CASCADE_DEPTH, CascadeProbabilitySource.PRIMARY);
    }
    
    public boolean isCascadeDepthAllowed(int depth) {
        return maxCascadeDepth < 0 || depth <= maxCascadeDepth;
    }
}
