package com.elssolution.insteonbridge.registry;

import com.elssolution.insteonbridge.domain.DeviceSnapshot;

import java.util.List;

/**
 * @param mode "live" or "mock"
 */
public record DiscoveryResult(List<DeviceSnapshot> devices, String mode, int count) {

    public static final String LIVE = "live";
    public static final String MOCK = "mock";

    public static DiscoveryResult of(List<DeviceSnapshot> devices, String mode) {
        return new DiscoveryResult(List.copyOf(devices), mode, devices.size());
    }
}
