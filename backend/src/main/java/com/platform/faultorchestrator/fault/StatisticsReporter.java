package com.platform.faultorchestrator.fault;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Side-effect free reads over the registry and success-rate counters.
 */
public class StatisticsReporter {
    
    private final FaultRegistry registry;
    private final Clock clock;
    
    public StatisticsReporter(FaultRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }
    
    public FaultStatistics report() {
        FaultRegistry.RegistryView view = registry.view();
        Instant now = clock.instant();
        
        Map<FaultKind, FaultStatus> current = new EnumMap<>(FaultKind.class);
        int active = 0;
        for (ActiveFault fault : view.faults()) {
            boolean isActive = fault.isActive();
            if (isActive) {
                active++;
            }
            current.put(fault.getKind(), new FaultStatus(
                isActive, fault.durationAt(now), fault.isRecoveryAttempted(), fault.getEffectiveDuration()));
        }
        
        return new FaultStatistics(active, view.historySize(), current, view.successRates());
    }
    
    /**
     * One line per active fault, in kind declaration order.
     */
    public List<String> recoveryStatus() {
        List<ActiveFault> active = new ArrayList<>(registry.activeFaults());
        active.sort(Comparator.comparing(ActiveFault::getKind));
        
        List<String> status = new ArrayList<>();
        for (ActiveFault fault : active) {
            if (fault.isRecoveryAttempted()) {
                status.add("Recovering from " + fault.getKind().getDisplayName());
            } else {
                status.add("Monitoring " + fault.getKind().getDisplayName());
            }
        }
        return status;
    }
}
