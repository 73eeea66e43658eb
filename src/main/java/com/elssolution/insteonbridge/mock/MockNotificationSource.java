package com.elssolution.insteonbridge.mock;

import com.elssolution.insteonbridge.gateway.NotificationSource;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

class MockNotificationSource<L> implements NotificationSource<L> {

    private final String name;
    private final int group;
    private final List<L> listeners = new CopyOnWriteArrayList<>();

    MockNotificationSource(String name, int group) {
        this.name = name;
        this.group = group;
    }

    @Override public String name() { return name; }

    @Override public int group() { return group; }

    @Override
    public void subscribe(L listener) {
        listeners.add(listener);
    }

    @Override
    public void unsubscribe(L listener) {
        listeners.remove(listener);
    }

    void fire(Consumer<L> call) {
        listeners.forEach(call);
    }

    int listenerCount() {
        return listeners.size();
    }
}
