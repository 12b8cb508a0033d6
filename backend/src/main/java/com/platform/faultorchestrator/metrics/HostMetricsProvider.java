package com.platform.faultorchestrator.metrics;

import com.platform.faultorchestrator.error.MetricsUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Samples CPU, heap memory and disk usage of the local host and applies the
 * synthetic fault overlay on top.
 * 
 * CPU is the one-minute load average per processor, so it is omitted on
 * platforms that do not report a load average.
 */
@Slf4j
public class HostMetricsProvider implements MetricsProvider {
    
    private final OperatingSystemMXBean osBean;
    private final MemoryMXBean memoryBean;
    private final File diskRoot;
    private final SyntheticLoad syntheticLoad;
    private final Clock clock;
    
    public HostMetricsProvider(File diskRoot, SyntheticLoad syntheticLoad, Clock clock) {
        this(ManagementFactory.getOperatingSystemMXBean(), ManagementFactory.getMemoryMXBean(),
            diskRoot, syntheticLoad, clock);
    }
    
    HostMetricsProvider(OperatingSystemMXBean osBean, MemoryMXBean memoryBean, File diskRoot,
                        SyntheticLoad syntheticLoad, Clock clock) {
        this.osBean = osBean;
        this.memoryBean = memoryBean;
        this.diskRoot = diskRoot;
        this.syntheticLoad = syntheticLoad;
        this.clock = clock;
    }
    
    @Override
    public SystemSnapshot snapshot() {
        try {
            Map<String, Double> values = new LinkedHashMap<>();
            
            double loadAverage = osBean.getSystemLoadAverage();
            int processors = Math.max(1, osBean.getAvailableProcessors());
            if (loadAverage >= 0) {
                values.put(SystemSnapshot.CPU_USAGE, percent(loadAverage, processors));
            }
            
            MemoryUsage heap = memoryBean.getHeapMemoryUsage();
            long heapLimit = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
            if (heapLimit > 0) {
                values.put(SystemSnapshot.MEMORY_USAGE, percent(heap.getUsed(), heapLimit));
            }
            
            long totalSpace = diskRoot.getTotalSpace();
            if (totalSpace > 0) {
                values.put(SystemSnapshot.DISK_USAGE, 
                    percent(totalSpace - diskRoot.getUsableSpace(), totalSpace));
            }
            
            if (values.isEmpty()) {
                throw new MetricsUnavailableException("No host metrics could be sampled");
            }
            
            return syntheticLoad.apply(new SystemSnapshot(values, clock.instant()));
            
        } catch (MetricsUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MetricsUnavailableException("Failed to sample host metrics: " + e.getMessage(), e);
        }
    }
    
    private static double percent(double used, double total) {
        return Math.min(100.0, Math.max(0.0, used / total * 100.0));
    }
}
