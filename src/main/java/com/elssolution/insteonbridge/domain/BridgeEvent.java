package com.elssolution.insteonbridge.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tagged event as delivered to subscribers: a {@code type} discriminator followed by
 * type-specific fields. Serializes as a flat JSON object.
 */
public final class BridgeEvent {

    private final EventType type;
    private final Map<String, Object> fields;

    private BridgeEvent(EventType type, Map<String, Object> fields) {
        this.type = type;
        this.fields = Collections.unmodifiableMap(fields);
    }

    public EventType type() {
        return type;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public Map<String, Object> fields() {
        return fields;
    }

    @JsonValue
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", type.wireName());
        out.putAll(fields);
        return out;
    }

    @Override
    public String toString() {
        return "BridgeEvent" + toMap();
    }

    // ---- factories ----

    public static BridgeEvent bridgeStatus(boolean connected, String port, String mode, String error) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("connected", connected);
        f.put("port", port);
        if (mode != null) f.put("mode", mode);
        if (error != null) f.put("error", error);
        return new BridgeEvent(EventType.BRIDGE_STATUS, f);
    }

    public static BridgeEvent deviceSnapshot(List<DeviceSnapshot> devices) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("count", devices.size());
        f.put("devices", List.copyOf(devices));
        return new BridgeEvent(EventType.DEVICE_SNAPSHOT, f);
    }

    public static BridgeEvent deviceAdded(DeviceSnapshot device) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("device", device);
        return new BridgeEvent(EventType.DEVICE_ADDED, f);
    }

    public static BridgeEvent deviceRemoved(String deviceId) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("device_id", deviceId);
        return new BridgeEvent(EventType.DEVICE_REMOVED, f);
    }

    public static BridgeEvent deviceEvent(String deviceId, String event, int group, String button,
                                          DeviceSnapshot device) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("device_id", deviceId);
        f.put("event", event);
        f.put("group", group);
        f.put("button", button);
        if (device != null) f.put("device", device);
        return new BridgeEvent(EventType.DEVICE_EVENT, f);
    }

    public static BridgeEvent deviceState(String deviceId, String name, int group, Object value,
                                          DeviceSnapshot device) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("device_id", deviceId);
        f.put("name", name);
        f.put("group", group);
        f.put("value", value);
        if (device != null) f.put("device", device);
        return new BridgeEvent(EventType.DEVICE_STATE, f);
    }

    public static BridgeEvent discoveryComplete(List<DeviceSnapshot> devices, String mode) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("device_count", devices.size());
        f.put("devices", List.copyOf(devices));
        f.put("mode", mode);
        return new BridgeEvent(EventType.DISCOVERY_COMPLETE, f);
    }

    public static BridgeEvent commandAck(String deviceId, String command, Integer level, boolean fast) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("device_id", deviceId);
        f.put("command", command);
        f.put("level", level);
        f.put("fast", fast);
        return new BridgeEvent(EventType.COMMAND_ACK, f);
    }

    public static BridgeEvent wsConnected(BridgeStatus status) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("status", status);
        return new BridgeEvent(EventType.WS_CONNECTED, f);
    }
}
