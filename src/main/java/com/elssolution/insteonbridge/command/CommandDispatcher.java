package com.elssolution.insteonbridge.command;

import com.elssolution.insteonbridge.domain.BridgeEvent;
import com.elssolution.insteonbridge.domain.DeviceIds;
import com.elssolution.insteonbridge.events.EventPipeline;
import com.elssolution.insteonbridge.exception.BridgeNotConnectedException;
import com.elssolution.insteonbridge.exception.CommandFailedException;
import com.elssolution.insteonbridge.exception.CommandUnsupportedException;
import com.elssolution.insteonbridge.exception.DeviceNotFoundException;
import com.elssolution.insteonbridge.gateway.DeviceOperation;
import com.elssolution.insteonbridge.gateway.GatewayDevice;
import com.elssolution.insteonbridge.gateway.OperationArgs;
import com.elssolution.insteonbridge.registry.DeviceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Maps a logical command ("on", "off", "status", ...) onto whichever operation the
 * device actually exposes, runs it and reports the outcome as a command_ack.
 *
 * No timeout: a handler that never completes blocks the caller.
 */
@Slf4j
@Component
public class CommandDispatcher {

    private final DeviceRegistry registry;
    private final EventPipeline events;

    public CommandDispatcher(DeviceRegistry registry, EventPipeline events) {
        this.registry = registry;
        this.events = events;
    }

    public BridgeEvent sendCommand(String rawId, String command, Integer level, boolean fast, Double duration) {
        String deviceId = DeviceIds.normalize(rawId);
        if (registry.currentGateway().isEmpty()) {
            throw new BridgeNotConnectedException("PLM not connected");
        }
        if (command == null || command.isBlank()) {
            throw new CommandUnsupportedException("Command required");
        }
        GatewayDevice device = registry.findLiveDevice(deviceId)
                .orElseThrow(() -> new DeviceNotFoundException("Insteon device " + deviceId + " not found"));

        List<String> candidates = candidateNames(command, fast);
        DeviceOperation operation = resolve(device, candidates)
                .orElseThrow(() -> new CommandUnsupportedException(
                        "Command '" + command + "' not supported for device " + deviceId));

        OperationArgs args = OperationArgs.builder()
                .level(LevelScale.toDevice(level))
                .duration(duration)
                .build();
        if (log.isDebugEnabled()) {
            log.debug("command_dispatch device={} command={} level={} deviceLevel={} fast={}",
                    deviceId, command, level, args.getLevel(), fast);
        }
        invoke(deviceId, command, operation, args);

        registry.updateCachedDevice(device, false);
        BridgeEvent ack = BridgeEvent.commandAck(deviceId, command, level, fast);
        events.publish(ack);
        log.info("command_sent device={} command={} level={} fast={}", deviceId, command, level, fast);
        return ack;
    }

    /** Operation names to try, most preferred first. */
    static List<String> candidateNames(String command, boolean fast) {
        String cmd = command.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        switch (cmd) {
            case "on":
            case "turn_on":
                return fast ? List.of("fast_on", "turn_on") : List.of("turn_on");
            case "off":
            case "turn_off":
                return fast ? List.of("fast_off", "turn_off") : List.of("turn_off");
            case "fast_on":
                return List.of("fast_on", "on_fast");
            case "fast_off":
                return List.of("fast_off", "off_fast");
            case "status":
            case "query":
            case "ping":
                return List.of("status_request", "get_status", "query_status");
            default:
                return List.of(cmd);
        }
    }

    private static Optional<DeviceOperation> resolve(GatewayDevice device, List<String> names) {
        List<String> spellings = new ArrayList<>();
        for (String name : names) {
            spellings.add("async_" + name);
            spellings.add(name);
        }
        for (String name : spellings) {
            Optional<DeviceOperation> op = device.operation(name);
            if (op.isPresent()) return op;
        }
        return Optional.empty();
    }

    private static void invoke(String deviceId, String command, DeviceOperation operation, OperationArgs args) {
        try {
            CompletionStage<?> stage = operation.invoke(args);
            if (stage != null) stage.toCompletableFuture().get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CommandFailedException("Interrupted while sending '" + command + "' to " + deviceId, ie);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("command_failed device={} command={}: {}", deviceId, command, cause.toString());
            throw new CommandFailedException("Command '" + command + "' failed: " + cause.getMessage(), cause);
        } catch (Exception e) {
            log.warn("command_failed device={} command={}: {}", deviceId, command, e.toString());
            throw new CommandFailedException("Command '" + command + "' failed: " + e.getMessage(), e);
        }
    }
}
