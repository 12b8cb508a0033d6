package com.platform.faultorchestrator.lifecycle;

import com.platform.faultorchestrator.config.FaultOrchestratorProperties;
import com.platform.faultorchestrator.fault.FaultOrchestrator;
import com.platform.faultorchestrator.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Graceful shutdown manager.
 * 
 * Order:
 * 1. Stop accepting injections
 * 2. Cancel active faults
 * 3. Wait for in-flight recovery tasks, interrupting stragglers after the timeout
 */
@Slf4j
@Component
public class GracefulShutdownManager implements ApplicationListener<ContextClosedEvent> {
    
    private final FaultOrchestrator orchestrator;
    private final MetricsRegistry metricsRegistry;
    private final Duration shutdownTimeout;
    
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    
    public GracefulShutdownManager(
            FaultOrchestrator orchestrator,
            MetricsRegistry metricsRegistry,
            FaultOrchestratorProperties properties) {
        this.orchestrator = orchestrator;
        this.metricsRegistry = metricsRegistry;
        this.shutdownTimeout = properties.getRecovery().getShutdownTimeout();
        
        log.info("Graceful shutdown manager initialized (timeout={})", shutdownTimeout);
    }
    
    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        performGracefulShutdown();
    }
    
    public boolean isShuttingDown() {
        return shuttingDown.get();
    }
    
    /**
     * Perform graceful shutdown.
     */
    public void performGracefulShutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            log.debug("Shutdown already in progress");
            return;
        }
        
        Instant start = Instant.now();
        log.info("========== GRACEFUL SHUTDOWN INITIATED ==========");
        
        try {
            boolean drained = orchestrator.shutdown(shutdownTimeout);
            
            metricsRegistry.incrementCounter("faultorchestrator.lifecycle.shutdown", 
                "status", drained ? "complete" : "forced");
            
            Duration duration = Duration.between(start, Instant.now());
            log.info("========== GRACEFUL SHUTDOWN {} ({} ms) ==========", 
                drained ? "COMPLETE" : "FORCED", duration.toMillis());
            
        } catch (RuntimeException e) {
            log.error("Error during graceful shutdown", e);
        }
    }
}
