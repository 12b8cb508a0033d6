package com.platform.faultorchestrator.metrics;

import com.platform.faultorchestrator.fault.FaultKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("SyntheticLoad Tests")
class SyntheticLoadTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final SyntheticLoad load = new SyntheticLoad();

    @Test
    @DisplayName("Should leave readings untouched without perturbations")
    void noPerturbation() {
        SystemSnapshot base = SystemSnapshot.of(40.0, 50.0, 60.0, NOW);

        assertThat(load.apply(base)).isSameAs(base);
        assertThat(load.multiplier(SystemSnapshot.CPU_USAGE)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should inflate only the affected metrics by the impact factor")
    void inflatesAffectedMetrics() {
        load.perturb(FaultKind.CPU_OVERLOAD, Set.of(SystemSnapshot.CPU_USAGE), 1.5);

        SystemSnapshot perturbed = load.apply(SystemSnapshot.of(40.0, 50.0, 60.0, NOW));

        assertThat(perturbed.value(SystemSnapshot.CPU_USAGE)).contains(60.0);
        assertThat(perturbed.value(SystemSnapshot.MEMORY_USAGE)).contains(50.0);
        assertThat(perturbed.timestamp()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should cap perturbed values at one hundred percent")
    void capsAtHundred() {
        load.perturb(FaultKind.DISK_FILL, Set.of(SystemSnapshot.DISK_USAGE), 1.2);

        SystemSnapshot perturbed = load.apply(SystemSnapshot.of(10.0, 10.0, 95.0, NOW));

        assertThat(perturbed.value(SystemSnapshot.DISK_USAGE)).contains(100.0);
    }

    @Test
    @DisplayName("Should combine overlapping perturbations multiplicatively")
    void combinesPerturbations() {
        load.perturb(FaultKind.CPU_OVERLOAD, Set.of(SystemSnapshot.CPU_USAGE), 1.5);
        load.perturb(FaultKind.IO_STRESS, Set.of(SystemSnapshot.CPU_USAGE, SystemSnapshot.DISK_USAGE), 1.4);

        assertThat(load.multiplier(SystemSnapshot.CPU_USAGE)).isCloseTo(2.1, within(1e-9));
        assertThat(load.multiplier(SystemSnapshot.DISK_USAGE)).isCloseTo(1.4, within(1e-9));
    }

    @Test
    @DisplayName("Should drain and drop perturbations as they are relieved")
    void relievesPerturbation() {
        load.perturb(FaultKind.MEMORY_LEAK, Set.of(SystemSnapshot.MEMORY_USAGE), 1.3);

        assertThat(load.relieve(FaultKind.MEMORY_LEAK, 0.5)).isCloseTo(0.5, within(1e-9));
        assertThat(load.multiplier(SystemSnapshot.MEMORY_USAGE)).isCloseTo(1.15, within(1e-9));
        assertThat(load.scale(FaultKind.MEMORY_LEAK, 0.5)).isCloseTo(0.25, within(1e-9));
        assertThat(load.relieve(FaultKind.MEMORY_LEAK, 0.25)).isZero();
        assertThat(load.multiplier(SystemSnapshot.MEMORY_USAGE)).isEqualTo(1.0);
        assertThat(load.relieve(FaultKind.MEMORY_LEAK, 0.1)).isZero();
    }
}
