package com.elssolution.insteonbridge.registry;

/**
 * Outcome of attaching one callback. Failures are logged by the registry and dropped;
 * they never abort the remaining subscriptions of a device.
 */
record SubscriptionResult(String deviceId, String source, DeviceSubscription<?> subscription, Exception failure) {

    static SubscriptionResult ok(String deviceId, DeviceSubscription<?> subscription) {
        return new SubscriptionResult(deviceId, subscription.describe(), subscription, null);
    }

    static SubscriptionResult failed(String deviceId, String source, Exception failure) {
        return new SubscriptionResult(deviceId, source, null, failure);
    }

    boolean succeeded() {
        return failure == null;
    }
}
