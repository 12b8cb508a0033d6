package com.platform.faultorchestrator.config;

import com.platform.faultorchestrator.error.ErrorCode;
import com.platform.faultorchestrator.error.ValidationException;
import com.platform.faultorchestrator.fault.CascadeProbabilitySource;
import com.platform.faultorchestrator.fault.FaultCatalog;
import com.platform.faultorchestrator.fault.FaultConfig;
import com.platform.faultorchestrator.fault.FaultKind;
import com.platform.faultorchestrator.fault.OrchestratorSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the fault orchestrator.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "faultorchestrator")
public class FaultOrchestratorProperties {
    
    @Valid
    private Recovery recovery = new Recovery();
    
    @Valid
    private Cascade cascade = new Cascade();
    
    /**
     * Root of the file system sampled for disk usage.
     */
    private String diskPath = "/";
    
    /**
     * Per-kind overrides. Unset fields keep the built-in defaults.
     */
    private Map<FaultKind, KindProperties> catalog = new EnumMap<>(FaultKind.class);
    
    @Data
    public static class Recovery {
        /**
         * Delay between consecutive recovery steps.
         */
        private Duration stepDelay = OrchestratorSettings.DEFAULT_STEP_DELAY;
        
        /**
         * Number of recovery outcomes retained.
         */
        @Min(1)
        private int historySize = OrchestratorSettings.DEFAULT_HISTORY_SIZE;
        
        /**
         * Threads available to recovery tasks.
         */
        @Min(1)
        private int workerThreads = 4;
        
        /**
         * How long shutdown waits for running recovery tasks.
         */
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }
    
    @Data
    public static class Cascade {
        /**
         * Deepest cascade level accepted. Negative disables the limit.
         */
        private int maxDepth = OrchestratorSettings.DEFAULT_MAX_CASCADE_DEPTH;
        
        private CascadeProbabilitySource probabilitySource = CascadeProbabilitySource.PRIMARY;
    }
    
    @Data
    public static class KindProperties {
        private boolean enabled = true;
        private Double impactFactor;
        private Integer recoverySteps;
        private List<String> metricsAffected;
        private Duration cooldown;
        private Duration maxDuration;
        private Double cascadeProbability;
        
        FaultConfig applyTo(FaultConfig defaults) {
            FaultConfig.FaultConfigBuilder builder = defaults.toBuilder();
            if (impactFactor != null) {
                builder.impactFactor(impactFactor);
            }
            if (recoverySteps != null) {
                builder.recoverySteps(recoverySteps);
            }
            if (metricsAffected != null) {
                builder.metricsAffected(new HashSet<>(metricsAffected));
            }
            if (cooldown != null) {
                builder.cooldown(cooldown);
            }
            if (maxDuration != null) {
                builder.maxDuration(maxDuration);
            }
            if (cascadeProbability != null) {
                builder.cascadeProbability(cascadeProbability);
            }
            return builder.build();
        }
    }
    
    /**
     * Built-in defaults merged with the configured overrides, minus disabled kinds.
     */
    public FaultCatalog toCatalog() {
        Map<FaultKind, FaultConfig> configs = new EnumMap<>(FaultKind.class);
        for (FaultKind kind : FaultKind.values()) {
            KindProperties overrides = catalog.get(kind);
            if (overrides == null) {
                configs.put(kind, FaultConfig.defaultsFor(kind));
            } else if (overrides.isEnabled()) {
                configs.put(kind, overridden(kind, overrides));
            }
        }
        return FaultCatalog.of(configs);
    }
    
    private static FaultConfig overridden(FaultKind kind, KindProperties overrides) {
        try {
            return overrides.applyTo(FaultConfig.defaultsFor(kind));
        } catch (ValidationException e) {
            throw new ValidationException(ErrorCode.CONFIGURATION_ERROR,
                String.format("Invalid catalog entry for %s: %s", kind.getDisplayName(), e.getMessage()), e);
        }
    }
    
    public OrchestratorSettings toSettings() {
        return OrchestratorSettings.builder()
            .stepDelay(recovery.getStepDelay())
            .historySize(recovery.getHistorySize())
            .maxCascadeDepth(cascade.getMaxDepth())
            .cascadeProbabilitySource(cascade.getProbabilitySource())
            .build();
    }
}
