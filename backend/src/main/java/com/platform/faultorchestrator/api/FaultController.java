package com.platform.faultorchestrator.api;

import com.platform.faultorchestrator.error.FaultInjectionException;
import com.platform.faultorchestrator.error.ResourceNotFoundException;
import com.platform.faultorchestrator.fault.ActiveFault;
import com.platform.faultorchestrator.fault.FaultConfig;
import com.platform.faultorchestrator.fault.FaultKind;
import com.platform.faultorchestrator.fault.FaultOrchestrator;
import com.platform.faultorchestrator.fault.FaultStatistics;
import com.platform.faultorchestrator.fault.FaultStatus;
import com.platform.faultorchestrator.fault.InjectionResult;
import com.platform.faultorchestrator.fault.RecoveryOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * REST API for fault injection and recovery.
 */
@RestController
@RequestMapping("/api/faults")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class FaultController {
    
    private final FaultOrchestrator orchestrator;
    
    /**
     * Get configured fault kinds.
     */
    @GetMapping("/kinds")
    public List<FaultKindInfo> getKinds() {
        return orchestrator.getCatalog().entries().entrySet().stream()
            .map(entry -> FaultKindInfo.of(entry.getKey(), entry.getValue()))
            .toList();
    }
    
    /**
     * Inject a fault. Omitting the duration injects for the kind's maximum.
     */
    @PostMapping("/{kind}/inject")
    public ResponseEntity<InjectionResponse> inject(
            @PathVariable String kind,
            @RequestParam(required = false) Long durationSeconds) {
        
        Duration requested = durationSeconds != null ? Duration.ofSeconds(durationSeconds) : null;
        InjectionResult result = orchestrator.inject(kind, requested);
        
        if (!result.accepted()) {
            throw new FaultInjectionException(result.rejection(), result.requestedKind(), result.reason());
        }
        
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(InjectionResponse.builder()
            .kind(result.kind().getDisplayName())
            .effectiveDurationSeconds(result.effectiveDuration().toSeconds())
            .faultId(orchestrator.findFault(result.kind()).map(ActiveFault::getId).orElse(null))
            .build());
    }
    
    /**
     * Active flag for every configured kind.
     */
    @GetMapping("/active")
    public Map<String, Boolean> getActiveFaults() {
        Map<String, Boolean> active = new LinkedHashMap<>();
        orchestrator.getActiveFaults().forEach((kind, flag) -> active.put(kind.getDisplayName(), flag));
        return active;
    }
    
    @GetMapping("/statistics")
    public StatisticsResponse getStatistics() {
        return StatisticsResponse.from(orchestrator.getFaultStatistics());
    }
    
    @GetMapping("/recovery-status")
    public List<String> getRecoveryStatus() {
        return orchestrator.getRecoveryStatus();
    }
    
    /**
     * Recent recovery outcomes, oldest first.
     */
    @GetMapping("/history")
    public List<RecoveryOutcome> getHistory() {
        return orchestrator.getRecoveryHistory();
    }
    
    /**
     * Cancel the active fault of a kind.
     */
    @DeleteMapping("/{kind}")
    public ResponseEntity<Void> cancel(@PathVariable String kind) {
        FaultKind faultKind = FaultKind.fromName(kind)
            .orElseThrow(() -> FaultInjectionException.unknownKind(kind));
        
        if (!orchestrator.cancelFault(faultKind)) {
            throw ResourceNotFoundException.activeFault(faultKind.getDisplayName());
        }
        return ResponseEntity.noContent().build();
    }
    
    // ==================== DTOs ====================
    
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FaultKindInfo {
        private String kind;
        private double impactFactor;
        private int recoverySteps;
        private Set<String> metricsAffected;
        private long cooldownSeconds;
        private long maxDurationSeconds;
        private double cascadeProbability;
        
        static FaultKindInfo of(FaultKind kind, FaultConfig config) {
            return FaultKindInfo.builder()
                .kind(kind.getDisplayName())
                .impactFactor(config.impactFactor())
                .recoverySteps(config.recoverySteps())
                .metricsAffected(new TreeSet<>(config.metricsAffected()))
                .cooldownSeconds(config.cooldown().toSeconds())
                .maxDurationSeconds(config.maxDuration().toSeconds())
                .cascadeProbability(config.cascadeProbability())
                .build();
        }
    }
    
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InjectionResponse {
        private String kind;
        private String faultId;
        private long effectiveDurationSeconds;
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FaultStatusResponse {
        private boolean active;
        private long durationSeconds;
        private boolean recoveryAttempted;
        
        static FaultStatusResponse from(FaultStatus status) {
            return new FaultStatusResponse(status.active(), status.durationSoFar().toSeconds(), 
                status.recoveryAttempted());
        }
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StatisticsResponse {
        private int activeFaults;
        private int historySize;
        private Map<String, FaultStatusResponse> currentFaults;
        private Map<String, Double> successRates;
        private Map<String, Long> attempts;
        
        static StatisticsResponse from(FaultStatistics stats) {
            Map<String, FaultStatusResponse> current = new LinkedHashMap<>();
            stats.currentFaults().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> current.put(e.getKey().getDisplayName(), FaultStatusResponse.from(e.getValue())));
            
            Map<String, Double> rates = new LinkedHashMap<>();
            Map<String, Long> attempts = new LinkedHashMap<>();
            stats.successRates().keySet().stream()
                .sorted()
                .forEach(kind -> {
                    rates.put(kind.getDisplayName(), stats.successRate(kind));
                    attempts.put(kind.getDisplayName(), stats.attempts(kind));
                });
            
            return new StatisticsResponse(stats.activeFaultCount(), stats.historySize(), current, rates, attempts);
        }
    }
}
