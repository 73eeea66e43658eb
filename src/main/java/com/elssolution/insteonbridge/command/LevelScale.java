package com.elssolution.insteonbridge.command;

/**
 * Brightness levels arrive either as a percentage (0..100) or on the device scale
 * (0..255). Anything above 100 is taken as already on the device scale.
 */
public final class LevelScale {

    public static final int DEVICE_MAX = 255;

    private LevelScale() {}

    public static Integer toDevice(Integer level) {
        if (level == null) return null;
        int clamped = Math.max(0, Math.min(DEVICE_MAX, level));
        if (clamped <= 100) {
            return (int) Math.round(clamped / 100.0 * DEVICE_MAX);
        }
        return clamped;
    }
}
