package com.platform.faultorchestrator.fault;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CooldownGate Tests")
class CooldownGateTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private CooldownGate gate;

    @BeforeEach
    void setUp() {
        Map<FaultKind, FaultConfig> configs = new EnumMap<>(FaultKind.class);
        configs.put(FaultKind.CPU_OVERLOAD, FaultConfig.defaultsFor(FaultKind.CPU_OVERLOAD));
        configs.put(FaultKind.DISK_FILL, FaultConfig.defaultsFor(FaultKind.DISK_FILL).toBuilder()
            .cooldown(Duration.ZERO)
            .build());
        gate = new CooldownGate(FaultCatalog.of(configs));
    }

    @Test
    @DisplayName("Should allow a kind that was never triggered")
    void allowsNeverTriggered() {
        assertThat(gate.check(FaultKind.CPU_OVERLOAD, T0)).isTrue();
        assertThat(gate.remaining(FaultKind.CPU_OVERLOAD, T0)).isZero();
    }

    @Test
    @DisplayName("Should block until the full cooldown has elapsed")
    void blocksWithinCooldown() {
        // Given
        gate.record(FaultKind.CPU_OVERLOAD, T0);

        // Then
        assertThat(gate.check(FaultKind.CPU_OVERLOAD, T0.plusSeconds(1))).isFalse();
        assertThat(gate.remaining(FaultKind.CPU_OVERLOAD, T0.plusSeconds(100)))
            .isEqualTo(Duration.ofSeconds(200));
        assertThat(gate.check(FaultKind.CPU_OVERLOAD, T0.plusSeconds(299))).isFalse();
        assertThat(gate.check(FaultKind.CPU_OVERLOAD, T0.plusSeconds(300))).isTrue();
    }

    @Test
    @DisplayName("Should always allow kinds with a zero cooldown")
    void zeroCooldownNeverBlocks() {
        gate.record(FaultKind.DISK_FILL, T0);

        assertThat(gate.check(FaultKind.DISK_FILL, T0)).isTrue();
    }

    @Test
    @DisplayName("Should track kinds independently")
    void kindsAreIndependent() {
        gate.record(FaultKind.CPU_OVERLOAD, T0);

        assertThat(gate.check(FaultKind.DISK_FILL, T0)).isTrue();
    }
}
