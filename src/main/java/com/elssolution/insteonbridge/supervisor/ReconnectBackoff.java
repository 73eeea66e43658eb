package com.elssolution.insteonbridge.supervisor;

import java.time.Duration;

/**
 * Doubling delay between reconnect attempts, capped at {@code max}.
 * For 5s/60s the sleeps are 5, 10, 20, 40, 60, 60, ...
 */
public class ReconnectBackoff {

    private final Duration initial;
    private final Duration max;
    private Duration current;

    public ReconnectBackoff(Duration initial, Duration max) {
        this.initial = initial;
        this.max = max.compareTo(initial) < 0 ? initial : max;
        this.current = initial;
    }

    /** The delay to sleep now; the following call returns double that, up to the cap. */
    public synchronized Duration nextDelay() {
        Duration d = current;
        Duration doubled = current.multipliedBy(2);
        current = doubled.compareTo(max) > 0 ? max : doubled;
        return d;
    }

    public synchronized Duration peek() {
        return current;
    }

    public synchronized void reset() {
        current = initial;
    }
}
