package com.platform.faultorchestrator.api;

import com.platform.faultorchestrator.error.FaultInjectionException;
import com.platform.faultorchestrator.error.GlobalExceptionHandler;
import com.platform.faultorchestrator.fault.FaultCatalog;
import com.platform.faultorchestrator.fault.FaultKind;
import com.platform.faultorchestrator.fault.FaultOrchestrator;
import com.platform.faultorchestrator.fault.FaultStatistics;
import com.platform.faultorchestrator.fault.FaultStatus;
import com.platform.faultorchestrator.fault.InjectionResult;
import com.platform.faultorchestrator.fault.SuccessRate;
import com.platform.faultorchestrator.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("FaultController Tests")
class FaultControllerTest {

    @Mock
    private FaultOrchestrator orchestrator;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new FaultController(orchestrator))
            .setControllerAdvice(new GlobalExceptionHandler(new MetricsRegistry(new SimpleMeterRegistry())))
            .build();
    }

    @Test
    @DisplayName("Should list the configured kinds")
    void listsKinds() throws Exception {
        when(orchestrator.getCatalog()).thenReturn(FaultCatalog.defaults());

        mockMvc.perform(get("/api/faults/kinds"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(4)))
            .andExpect(jsonPath("$[0].kind").value("CPUOverload"))
            .andExpect(jsonPath("$[0].maxDurationSeconds").value(60))
            .andExpect(jsonPath("$[3].metricsAffected", hasSize(2)));
    }

    @Test
    @DisplayName("Should accept an injection with the clamped duration")
    void acceptsInjection() throws Exception {
        when(orchestrator.inject("CPUOverload", Duration.ofSeconds(90)))
            .thenReturn(InjectionResult.accepted(FaultKind.CPU_OVERLOAD, Duration.ofSeconds(60), 0));

        mockMvc.perform(post("/api/faults/CPUOverload/inject").param("durationSeconds", "90"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.kind").value("CPUOverload"))
            .andExpect(jsonPath("$.effectiveDurationSeconds").value(60));
    }

    @Test
    @DisplayName("Should inject for the maximum duration when none is given")
    void injectsWithoutDuration() throws Exception {
        when(orchestrator.inject("disk-fill", null))
            .thenReturn(InjectionResult.accepted(FaultKind.DISK_FILL, Duration.ofSeconds(30), 0));

        mockMvc.perform(post("/api/faults/disk-fill/inject"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.kind").value("DiskFill"));

        verify(orchestrator).inject(eq("disk-fill"), isNull());
    }

    @Test
    @DisplayName("Should answer 409 for injections in cooldown")
    void cooldownConflict() throws Exception {
        when(orchestrator.inject("MemoryLeak", Duration.ofSeconds(10)))
            .thenReturn(InjectionResult.rejected(FaultKind.MEMORY_LEAK, "MemoryLeak",
                FaultInjectionException.inCooldown("MemoryLeak", Duration.ofSeconds(120)), 0));

        mockMvc.perform(post("/api/faults/MemoryLeak/inject").param("durationSeconds", "10"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("FO-310"))
            .andExpect(jsonPath("$.metadata.faultKind").value("MemoryLeak"));
    }

    @Test
    @DisplayName("Should answer 404 for unknown kinds")
    void unknownKind() throws Exception {
        when(orchestrator.inject("Meltdown", Duration.ofSeconds(10)))
            .thenReturn(InjectionResult.rejected(null, "Meltdown",
                FaultInjectionException.unknownKind("Meltdown"), 0));

        mockMvc.perform(post("/api/faults/Meltdown/inject").param("durationSeconds", "10"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("FO-300"));
    }

    @Test
    @DisplayName("Should answer 400 for a malformed duration")
    void malformedDuration() throws Exception {
        mockMvc.perform(post("/api/faults/CPUOverload/inject").param("durationSeconds", "soon"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("FO-100"));
    }

    @Test
    @DisplayName("Should report active flags by display name")
    void activeFlags() throws Exception {
        Map<FaultKind, Boolean> flags = new EnumMap<>(FaultKind.class);
        flags.put(FaultKind.CPU_OVERLOAD, true);
        flags.put(FaultKind.DISK_FILL, false);
        when(orchestrator.getActiveFaults()).thenReturn(flags);

        mockMvc.perform(get("/api/faults/active"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.CPUOverload").value(true))
            .andExpect(jsonPath("$.DiskFill").value(false));
    }

    @Test
    @DisplayName("Should report statistics and recovery status")
    void statistics() throws Exception {
        when(orchestrator.getFaultStatistics()).thenReturn(new FaultStatistics(1, 3,
            Map.of(FaultKind.IO_STRESS, new FaultStatus(true, Duration.ofSeconds(7), true, Duration.ofSeconds(40))),
            Map.of(FaultKind.IO_STRESS, new SuccessRate(4, 3))));
        when(orchestrator.getRecoveryStatus()).thenReturn(List.of("Recovering from IOStress"));

        mockMvc.perform(get("/api/faults/statistics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.activeFaults").value(1))
            .andExpect(jsonPath("$.historySize").value(3))
            .andExpect(jsonPath("$.currentFaults.IOStress.durationSeconds").value(7))
            .andExpect(jsonPath("$.currentFaults.IOStress.recoveryAttempted").value(true))
            .andExpect(jsonPath("$.successRates.IOStress").value(0.75))
            .andExpect(jsonPath("$.attempts.IOStress").value(4));

        mockMvc.perform(get("/api/faults/recovery-status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0]").value("Recovering from IOStress"));
    }

    @Test
    @DisplayName("Should cancel an active fault")
    void cancelsFault() throws Exception {
        when(orchestrator.cancelFault(FaultKind.IO_STRESS)).thenReturn(true);

        mockMvc.perform(delete("/api/faults/io_stress"))
            .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("Should answer 404 when cancelling a kind that is not active")
    void cancelInactiveFault() throws Exception {
        when(orchestrator.cancelFault(FaultKind.CPU_OVERLOAD)).thenReturn(false);

        mockMvc.perform(delete("/api/faults/CPUOverload"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("FO-301"));
    }
}
