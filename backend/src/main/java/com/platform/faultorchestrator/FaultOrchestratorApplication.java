package com.platform.faultorchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Fault Orchestrator Application
 * 
 * Injects synthetic faults into monitored metrics and drives their recovery:
 * - Per-kind cooldowns and duration limits
 * - Concurrent multi-step recovery with improvement tracking
 * - Probabilistic cascades with a depth budget
 * - Success-rate statistics over recovery outcomes
 */
@SpringBootApplication
public class FaultOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(FaultOrchestratorApplication.class, args);
    }
}
