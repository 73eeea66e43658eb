package com.elssolution.insteonbridge.registry;

import com.elssolution.insteonbridge.gateway.NotificationSource;

/** A callback attached to one notification source of a device. */
record DeviceSubscription<L>(NotificationSource<L> source, L listener) {

    void release() {
        source.unsubscribe(listener);
    }

    String describe() {
        return source.name() + "/" + source.group();
    }
}
