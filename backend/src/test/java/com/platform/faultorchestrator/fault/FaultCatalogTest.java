package com.platform.faultorchestrator.fault;

import com.platform.faultorchestrator.error.ErrorCode;
import com.platform.faultorchestrator.error.FaultInjectionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FaultCatalog Tests")
class FaultCatalogTest {

    @Test
    @DisplayName("Should contain every kind in declaration order by default")
    void defaultsContainAllKinds() {
        FaultCatalog catalog = FaultCatalog.defaults();

        assertThat(catalog.kinds()).containsExactly(FaultKind.values());
        assertThat(catalog.get(FaultKind.MEMORY_LEAK).recoverySteps()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should reject lookups of kinds missing from the catalog")
    void rejectsMissingKind() {
        Map<FaultKind, FaultConfig> configs = new EnumMap<>(FaultKind.class);
        configs.put(FaultKind.CPU_OVERLOAD, FaultConfig.defaultsFor(FaultKind.CPU_OVERLOAD));
        FaultCatalog catalog = FaultCatalog.of(configs);

        assertThat(catalog.kinds().contains(FaultKind.DISK_FILL)).isFalse();
        assertThat(catalog.find(FaultKind.DISK_FILL)).isEmpty();
        assertThatThrownBy(() -> catalog.get(FaultKind.DISK_FILL))
            .isInstanceOf(FaultInjectionException.class)
            .hasMessageContaining("DiskFill")
            .extracting(e -> ((FaultInjectionException) e).getErrorCode())
            .isEqualTo(ErrorCode.UNKNOWN_FAULT_KIND);
    }

    @Test
    @DisplayName("Should not be affected by later changes to the source map")
    void isImmutable() {
        Map<FaultKind, FaultConfig> configs = new EnumMap<>(FaultKind.class);
        configs.put(FaultKind.CPU_OVERLOAD, FaultConfig.defaultsFor(FaultKind.CPU_OVERLOAD));
        FaultCatalog catalog = FaultCatalog.of(configs);

        configs.put(FaultKind.IO_STRESS, FaultConfig.defaultsFor(FaultKind.IO_STRESS));

        assertThat(catalog.kinds()).containsExactly(FaultKind.CPU_OVERLOAD);
    }
}
