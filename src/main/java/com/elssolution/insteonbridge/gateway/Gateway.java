package com.elssolution.insteonbridge.gateway;

import com.elssolution.insteonbridge.domain.DeviceIds;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Live handle to a connected gateway (a PLM or the in-process mock). Valid only while
 * the connection persists; the supervisor owns it and closes it on teardown.
 */
public interface Gateway {

    /** Devices currently known to the gateway, possibly including the modem itself. */
    Collection<GatewayDevice> devices();

    /** Search by address; separators and case are ignored. */
    default Optional<GatewayDevice> findDevice(String address) {
        String wanted = DeviceIds.normalize(address);
        return devices().stream()
                .filter(d -> DeviceIds.normalize(d.address()).equals(wanted))
                .findFirst();
    }

    /**
     * (Re)load the device list. With {@code refresh} the gateway also re-identifies
     * devices and reloads the modem link database.
     */
    CompletableFuture<Void> load(boolean refresh);

    /** The modem sub-handle, when the gateway exposes one. */
    default Optional<GatewayModem> modem() {
        return Optional.empty();
    }

    void subscribe(GatewayListener listener);

    void unsubscribe(GatewayListener listener);

    CompletableFuture<Void> close();
}
