package com.elssolution.insteonbridge.gateway;

/**
 * A per-device event or state group that callbacks can be attached to.
 *
 * @param <L> listener type
 */
public interface NotificationSource<L> {

    String name();

    int group();

    void subscribe(L listener);

    void unsubscribe(L listener);
}
