package com.elssolution.insteonbridge.events;

import com.elssolution.insteonbridge.domain.BridgeEvent;
import com.elssolution.insteonbridge.domain.EventType;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class RecordingSubscriber implements EventSubscriber {

    public final List<BridgeEvent> received = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public void failFromNowOn() {
        failing = true;
    }

    @Override
    public void send(BridgeEvent event) throws Exception {
        if (failing) throw new IOException("broken pipe");
        received.add(event);
    }

    public List<EventType> types() {
        return received.stream().map(BridgeEvent::type).collect(Collectors.toList());
    }

    public List<BridgeEvent> ofType(EventType type) {
        return received.stream().filter(e -> e.type() == type).collect(Collectors.toList());
    }
}
