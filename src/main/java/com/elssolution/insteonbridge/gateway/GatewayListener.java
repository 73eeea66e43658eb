package com.elssolution.insteonbridge.gateway;

/**
 * Gateway-level notifications. Implementations may be called from library threads.
 */
public interface GatewayListener {

    enum DeviceChange { ADDED, REMOVED }

    void onDeviceChange(DeviceChange change, String address);

    default void onConnectionLost(Throwable cause) {
    }
}
