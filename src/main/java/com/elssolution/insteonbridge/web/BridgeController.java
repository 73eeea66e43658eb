package com.elssolution.insteonbridge.web;

import com.elssolution.insteonbridge.domain.BridgeEvent;
import com.elssolution.insteonbridge.domain.DeviceSnapshot;
import com.elssolution.insteonbridge.exception.CommandUnsupportedException;
import com.elssolution.insteonbridge.registry.DiscoveryResult;
import com.elssolution.insteonbridge.service.InsteonBridgeService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
public class BridgeController {

    private final InsteonBridgeService bridge;

    public BridgeController(InsteonBridgeService bridge) {
        this.bridge = bridge;
    }

    @GetMapping("/status")
    public Map<String, Object> getStatus() {
        return ok("status", bridge.statusSnapshot());
    }

    @PostMapping("/discovery")
    public Map<String, Object> runDiscovery(@RequestBody(required = false) DiscoveryRequest body) {
        Boolean refresh = body != null ? body.refresh() : null;
        log.info("[REST] POST /discovery refresh={}", refresh);
        DiscoveryResult result = bridge.runDiscovery(refresh);
        Map<String, Object> out = ok("devices", result.devices());
        out.put("mode", result.mode());
        out.put("count", result.count());
        return out;
    }

    @GetMapping("/devices")
    public Map<String, Object> listDevices() {
        List<DeviceSnapshot> devices = bridge.listDevices();
        return ok("devices", devices);
    }

    @GetMapping("/devices/{id}")
    public Map<String, Object> getDevice(@PathVariable("id") String id) {
        return ok("device", bridge.getDevice(id));
    }

    @PostMapping("/devices/{id}/command")
    public Map<String, Object> sendCommand(@PathVariable("id") String id,
                                           @RequestBody(required = false) CommandRequest body) {
        if (body == null || body.command() == null || body.command().isBlank()) {
            throw new CommandUnsupportedException("command field required");
        }
        log.info("[REST] POST /devices/{}/command command={} level={} fast={}", id, body.command(), body.level(), body.fast());
        BridgeEvent ack = bridge.sendCommand(id, body.command(), body.level(), body.fast(), body.duration());
        return ok("result", ack);
    }

    private static Map<String, Object> ok(String key, Object value) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        out.put(key, value);
        return out;
    }

    public record DiscoveryRequest(Boolean refresh) {}

    public record CommandRequest(String command, Integer level, Boolean fast, Double duration) {}
}
