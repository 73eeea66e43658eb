package com.elssolution.insteonbridge.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/** Capability labels as they appear in snapshots and the cache file. */
public enum Capability {
    SWITCH("switch"),
    DIMMER("dimmer"),
    FAST_ON("fast_on"),
    FAST_OFF("fast_off"),
    STATUS_QUERY("status_query"),
    BATTERY("battery"),
    SCENE_CONTROLLER("scene_controller"),
    KEYPAD("keypad");

    private final String label;

    Capability(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<Capability> fromLabel(String label) {
        if (label == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(c -> c.label.equalsIgnoreCase(label.trim()))
                .findFirst();
    }

    @JsonCreator
    static Capability ofLabel(String label) {
        return fromLabel(label)
                .orElseThrow(() -> new IllegalArgumentException("Unknown capability: " + label));
    }
}
