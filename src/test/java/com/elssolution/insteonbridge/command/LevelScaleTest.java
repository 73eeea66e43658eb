package com.elssolution.insteonbridge.command;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LevelScaleTest {

    @Test
    void percentagesAreRescaled() {
        assertThat(LevelScale.toDevice(0)).isZero();
        assertThat(LevelScale.toDevice(50)).isEqualTo(128);
        assertThat(LevelScale.toDevice(100)).isEqualTo(255);
    }

    @Test
    void valuesAbove100AreAlreadyDeviceScale() {
        assertThat(LevelScale.toDevice(101)).isEqualTo(101);
        assertThat(LevelScale.toDevice(200)).isEqualTo(200);
    }

    @Test
    void outOfRangeIsClamped() {
        assertThat(LevelScale.toDevice(-5)).isZero();
        assertThat(LevelScale.toDevice(300)).isEqualTo(255);
    }

    @Test
    void absentStaysAbsent() {
        assertThat(LevelScale.toDevice(null)).isNull();
    }
}
