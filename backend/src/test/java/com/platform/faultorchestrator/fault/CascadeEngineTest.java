package com.platform.faultorchestrator.fault;

import com.platform.faultorchestrator.error.FaultInjectionException;
import com.platform.faultorchestrator.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CascadeEngine Tests")
class CascadeEngineTest {

    @Mock
    private CascadeInjector injector;

    private final FaultCatalog catalog = FaultCatalog.defaults();
    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry(new SimpleMeterRegistry());
    }

    private CascadeEngine engine(double draw, CascadeProbabilitySource source) {
        return new CascadeEngine(catalog, () -> draw, source, injector, metrics);
    }

    private static InjectionResult acceptAsRequested(InvocationOnMock invocation) {
        FaultKind kind = invocation.getArgument(0);
        Duration duration = invocation.getArgument(1);
        Integer depth = invocation.getArgument(2);
        return InjectionResult.accepted(kind, duration, depth);
    }

    @Test
    @DisplayName("Should cascade only when the draw falls below the primary probability")
    void shouldCascadeDraw() {
        assertThat(engine(0.29, CascadeProbabilitySource.PRIMARY).shouldCascade(FaultKind.CPU_OVERLOAD)).isTrue();
        assertThat(engine(0.30, CascadeProbabilitySource.PRIMARY).shouldCascade(FaultKind.CPU_OVERLOAD)).isFalse();
    }

    @Test
    @DisplayName("Should attempt every other kind at half its maximum duration one level deeper")
    void primarySourceTargetsAllOthers() {
        // Given
        when(injector.inject(any(), any(), anyInt()))
            .thenAnswer(CascadeEngineTest::acceptAsRequested);

        // When
        List<InjectionResult> results = engine(0.34, CascadeProbabilitySource.PRIMARY)
            .cascade(FaultKind.IO_STRESS, 0);

        // Then
        assertThat(results).extracting(InjectionResult::kind)
            .containsExactly(FaultKind.CPU_OVERLOAD, FaultKind.MEMORY_LEAK, FaultKind.DISK_FILL);
        verify(injector).inject(FaultKind.CPU_OVERLOAD, Duration.ofSeconds(30), 1);
        verify(injector).inject(FaultKind.MEMORY_LEAK, Duration.ofSeconds(23), 1);
        verify(injector).inject(FaultKind.DISK_FILL, Duration.ofSeconds(15), 1);
        verify(injector, never()).inject(eq(FaultKind.IO_STRESS), any(), anyInt());
        assertThat(metrics.getCounterValue("faultorchestrator.cascade.triggered",
            "source", "IOStress", "target", "CPUOverload")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should use each target's own probability when configured to")
    void targetSourceUsesTargetProbability() {
        // Given
        when(injector.inject(any(), any(), anyInt()))
            .thenAnswer(CascadeEngineTest::acceptAsRequested);

        // When
        List<InjectionResult> results = engine(0.22, CascadeProbabilitySource.TARGET)
            .cascade(FaultKind.IO_STRESS, 1);

        // Then
        assertThat(results).extracting(InjectionResult::kind)
            .containsExactly(FaultKind.CPU_OVERLOAD, FaultKind.MEMORY_LEAK);
        assertThat(results).extracting(InjectionResult::cascadeDepth).containsOnly(2);
        verify(injector, never()).inject(eq(FaultKind.DISK_FILL), any(), anyInt());
    }

    @Test
    @DisplayName("Should drop rejected secondary injections")
    void dropsRejectedCascades() {
        // Given
        when(injector.inject(any(), any(), anyInt())).thenAnswer(inv -> {
            FaultKind target = inv.getArgument(0);
            return InjectionResult.rejected(target, target.getDisplayName(),
                FaultInjectionException.inCooldown(target.getDisplayName(), Duration.ofSeconds(5)), 1);
        });

        // When
        List<InjectionResult> results = engine(0.0, CascadeProbabilitySource.PRIMARY)
            .cascade(FaultKind.CPU_OVERLOAD, 0);

        // Then
        assertThat(results).hasSize(3).noneMatch(InjectionResult::accepted);
        assertThat(metrics.getCounterValue("faultorchestrator.cascade.triggered",
            "source", "CPUOverload", "target", "MemoryLeak")).isZero();
    }

    @Test
    @DisplayName("Should attempt nothing when every draw misses")
    void noCascadeWhenDrawMisses() {
        List<InjectionResult> results = engine(0.99, CascadeProbabilitySource.PRIMARY)
            .cascade(FaultKind.IO_STRESS, 0);

        assertThat(results).isEmpty();
        verify(injector, never()).inject(any(), any(), anyInt());
    }
}
