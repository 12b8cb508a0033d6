package com.platform.faultorchestrator.config;

import com.platform.faultorchestrator.fault.FaultCatalog;
import com.platform.faultorchestrator.fault.FaultOrchestrator;
import com.platform.faultorchestrator.fault.behavior.FaultBehaviors;
import com.platform.faultorchestrator.metrics.HostMetricsProvider;
import com.platform.faultorchestrator.metrics.MetricsProvider;
import com.platform.faultorchestrator.metrics.SyntheticLoad;
import com.platform.faultorchestrator.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.File;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Wiring of the orchestrator and its default collaborators.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(FaultOrchestratorProperties.class)
public class FaultOrchestratorConfig {
    
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    @Bean
    public FaultCatalog faultCatalog(FaultOrchestratorProperties properties) {
        FaultCatalog catalog = properties.toCatalog();
        log.info("Fault catalog loaded with {} kinds: {}", catalog.kinds().size(), catalog.kinds());
        return catalog;
    }
    
    @Bean
    public SyntheticLoad syntheticLoad() {
        return new SyntheticLoad();
    }
    
    @Bean
    @ConditionalOnMissingBean
    public MetricsProvider metricsProvider(FaultOrchestratorProperties properties, 
                                           SyntheticLoad syntheticLoad, Clock clock) {
        return new HostMetricsProvider(new File(properties.getDiskPath()), syntheticLoad, clock);
    }
    
    @Bean
    public FaultBehaviors faultBehaviors(FaultCatalog catalog, SyntheticLoad syntheticLoad) {
        return new FaultBehaviors(catalog, syntheticLoad);
    }
    
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService recoveryExecutor(FaultOrchestratorProperties properties) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("fault-recovery-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(properties.getRecovery().getWorkerThreads(), threadFactory);
    }
    
    @Bean
    public FaultOrchestrator faultOrchestrator(
            FaultCatalog catalog,
            MetricsProvider metricsProvider,
            FaultBehaviors faultBehaviors,
            ExecutorService recoveryExecutor,
            Clock clock,
            FaultOrchestratorProperties properties,
            MetricsRegistry metricsRegistry) {
        return new FaultOrchestrator(
            catalog,
            metricsProvider,
            faultBehaviors,
            faultBehaviors,
            recoveryExecutor,
            clock,
            () -> ThreadLocalRandom.current().nextDouble(),
            properties.toSettings(),
            metricsRegistry);
    }
}
