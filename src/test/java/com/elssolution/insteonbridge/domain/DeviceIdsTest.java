package com.elssolution.insteonbridge.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceIdsTest {

    @Test
    void separatorsAndCaseAreIgnored() {
        assertThat(DeviceIds.normalize("1A.2B.3C")).isEqualTo("1a2b3c");
        assertThat(DeviceIds.normalize("1a:2b:3c")).isEqualTo("1a2b3c");
        assertThat(DeviceIds.normalize(" 1A2B3C ")).isEqualTo("1a2b3c");
    }

    @Test
    void normalizeIsIdempotent() {
        String once = DeviceIds.normalize("AA.bb:CC");
        assertThat(DeviceIds.normalize(once)).isEqualTo(once);
    }

    @Test
    void nullBecomesUnknown() {
        assertThat(DeviceIds.normalize(null)).isEqualTo(DeviceIds.UNKNOWN);
    }

    @Test
    void sameDeviceComparesNormalizedForms() {
        assertThat(DeviceIds.sameDevice("11.22.33", "112233")).isTrue();
        assertThat(DeviceIds.sameDevice("11.22.33", "11.22.34")).isFalse();
    }
}
