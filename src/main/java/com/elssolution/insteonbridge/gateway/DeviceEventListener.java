package com.elssolution.insteonbridge.gateway;

/** Button/command events sent by a device (on, off, fast_on, ...). */
@FunctionalInterface
public interface DeviceEventListener {

    void onEvent(String name, String address, int group, String button);
}
