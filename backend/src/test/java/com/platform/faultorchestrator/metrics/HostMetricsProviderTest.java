package com.platform.faultorchestrator.metrics;

import com.platform.faultorchestrator.error.MetricsUnavailableException;
import com.platform.faultorchestrator.fault.FaultKind;
import com.platform.faultorchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.File;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("HostMetricsProvider Tests")
class HostMetricsProviderTest {

    @Mock
    private OperatingSystemMXBean osBean;

    @Mock
    private MemoryMXBean memoryBean;

    @Mock
    private File diskRoot;

    private SyntheticLoad syntheticLoad;
    private MutableClock clock;
    private HostMetricsProvider provider;

    @BeforeEach
    void setUp() {
        syntheticLoad = new SyntheticLoad();
        clock = MutableClock.atEpochStart();
        provider = new HostMetricsProvider(osBean, memoryBean, diskRoot, syntheticLoad, clock);
    }

    private void hostReports(double loadAverage, long heapUsed, long heapMax, long diskTotal, long diskUsable) {
        when(osBean.getSystemLoadAverage()).thenReturn(loadAverage);
        when(osBean.getAvailableProcessors()).thenReturn(4);
        when(memoryBean.getHeapMemoryUsage()).thenReturn(new MemoryUsage(0, heapUsed, heapMax, heapMax));
        when(diskRoot.getTotalSpace()).thenReturn(diskTotal);
        lenient().when(diskRoot.getUsableSpace()).thenReturn(diskUsable);
    }

    @Test
    @DisplayName("Should derive usage percentages from the host beans")
    void samplesHost() {
        // Given
        hostReports(2.0, 512, 1024, 1000, 250);

        // When
        SystemSnapshot snapshot = provider.snapshot();

        // Then
        assertThat(snapshot.value(SystemSnapshot.CPU_USAGE)).hasValueSatisfying(v -> assertThat(v).isCloseTo(50.0, within(1e-9)));
        assertThat(snapshot.value(SystemSnapshot.MEMORY_USAGE)).hasValueSatisfying(v -> assertThat(v).isCloseTo(50.0, within(1e-9)));
        assertThat(snapshot.value(SystemSnapshot.DISK_USAGE)).hasValueSatisfying(v -> assertThat(v).isCloseTo(75.0, within(1e-9)));
        assertThat(snapshot.timestamp()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("Should omit CPU when the platform reports no load average")
    void omitsCpuWithoutLoadAverage() {
        hostReports(-1.0, 512, 1024, 1000, 250);

        SystemSnapshot snapshot = provider.snapshot();

        assertThat(snapshot.value(SystemSnapshot.CPU_USAGE)).isEmpty();
        assertThat(snapshot.value(SystemSnapshot.DISK_USAGE)).isPresent();
    }

    @Test
    @DisplayName("Should apply the synthetic fault overlay")
    void appliesOverlay() {
        hostReports(2.0, 512, 1024, 1000, 250);
        syntheticLoad.perturb(FaultKind.CPU_OVERLOAD, Set.of(SystemSnapshot.CPU_USAGE), 1.5);

        SystemSnapshot snapshot = provider.snapshot();

        assertThat(snapshot.value(SystemSnapshot.CPU_USAGE)).hasValueSatisfying(v -> assertThat(v).isCloseTo(75.0, within(1e-9)));
    }

    @Test
    @DisplayName("Should fail when nothing can be sampled")
    void failsWhenNothingSampled() {
        hostReports(-1.0, 0, 0, 0, 0);

        assertThatThrownBy(provider::snapshot)
            .isInstanceOf(MetricsUnavailableException.class)
            .hasMessageContaining("No host metrics");
    }

    @Test
    @DisplayName("Should wrap unexpected sampling errors")
    void wrapsSamplingErrors() {
        when(osBean.getSystemLoadAverage()).thenThrow(new SecurityException("denied"));

        assertThatThrownBy(provider::snapshot)
            .isInstanceOf(MetricsUnavailableException.class)
            .hasCauseInstanceOf(SecurityException.class);
    }
}
