package com.elssolution.insteonbridge.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Serializable point-in-time view of one device. This is what the cache file, the
 * REST surface and event payloads carry.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.ALWAYS)
public class DeviceSnapshot {
    String id;                 // normalized address
    String address;            // same value as id
    String name;
    Integer category;
    Integer subcategory;
    String productKey;
    String firmware;
    List<Capability> capabilities;   // sorted by label
    Map<String, Object> state;       // channel -> scalar or null
    String lastSeen;                 // ISO-8601
    Map<String, String> raw;

    /**
     * On/off as far as the state channels tell. A level channel counts by its
     * truthiness; without one we fall back to an on_off channel.
     */
    @JsonIgnore
    public boolean isOn() {
        if (state == null) return false;
        for (Map.Entry<String, Object> e : state.entrySet()) {
            if (e.getKey().toLowerCase().startsWith("level")) return truthy(e.getValue());
        }
        for (Map.Entry<String, Object> e : state.entrySet()) {
            if (e.getKey().toLowerCase().startsWith("on_off")) return truthy(e.getValue());
        }
        return false;
    }

    /** Copy with id and address re-normalized. */
    public DeviceSnapshot normalized() {
        String norm = DeviceIds.normalize(id != null ? id : address);
        String addr = address != null ? DeviceIds.normalize(address) : norm;
        if (norm.equals(id) && addr.equals(address)) return this;
        return toBuilder().id(norm).address(addr).build();
    }

    private static boolean truthy(Object v) {
        if (v == null) return false;
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.doubleValue() != 0.0;
        if (v instanceof String s) return !s.isEmpty();
        return true;
    }
}
