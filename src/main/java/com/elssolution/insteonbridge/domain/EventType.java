package com.elssolution.insteonbridge.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {
    BRIDGE_STATUS("bridge_status"),
    DEVICE_SNAPSHOT("device_snapshot"),
    DEVICE_ADDED("device_added"),
    DEVICE_REMOVED("device_removed"),
    DEVICE_EVENT("device_event"),
    DEVICE_STATE("device_state"),
    DISCOVERY_COMPLETE("discovery_complete"),
    COMMAND_ACK("command_ack"),
    WS_CONNECTED("ws_connected");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
