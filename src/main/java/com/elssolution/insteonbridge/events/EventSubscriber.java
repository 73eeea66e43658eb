package com.elssolution.insteonbridge.events;

import com.elssolution.insteonbridge.domain.BridgeEvent;

/**
 * Something attached to the event feed (a WebSocket session, a test recorder).
 * The pipeline never owns its lifetime; a failing send just detaches it.
 */
public interface EventSubscriber {

    void send(BridgeEvent event) throws Exception;

    default String describe() {
        return toString();
    }
}
