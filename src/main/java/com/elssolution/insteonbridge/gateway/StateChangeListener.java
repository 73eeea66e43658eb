package com.elssolution.insteonbridge.gateway;

/** Value change of a device state group. */
@FunctionalInterface
public interface StateChangeListener {

    void onStateChange(String name, String address, Object value, int group);
}
