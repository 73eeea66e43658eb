package com.elssolution.insteonbridge.gateway;

import com.elssolution.insteonbridge.config.BridgeSettings;
import com.elssolution.insteonbridge.exception.GatewayConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.function.Supplier;

/**
 * Connects through whichever {@link GatewayDriver} is on the classpath. No driver, a
 * missing device node or a port that won't open all surface as
 * {@link GatewayConnectionException} so the supervisor can back off or fall back to mock.
 */
@Slf4j
@Component
public class DriverGatewayConnector implements GatewayConnector {

    private final BridgeSettings settings;
    private final Supplier<Optional<GatewayDriver>> drivers;

    @Autowired
    public DriverGatewayConnector(BridgeSettings settings) {
        this(settings, DriverGatewayConnector::loadDriver);
    }

    DriverGatewayConnector(BridgeSettings settings, Supplier<Optional<GatewayDriver>> drivers) {
        this.settings = settings;
        this.drivers = drivers;
    }

    @Override
    public Gateway connect(String port) throws GatewayConnectionException {
        GatewayDriver driver = drivers.get()
                .orElseThrow(() -> new GatewayConnectionException("no gateway driver installed"));

        if (!SerialPortProbe.devicePresent(port)) {
            throw new GatewayConnectionException("Serial device missing: " + port);
        }
        if (settings.isSerialProbe() && !SerialPortProbe.canOpen(port)) {
            throw new GatewayConnectionException("Cannot open serial port: " + port);
        }

        log.info("gateway_connecting port={} driver={}", port, driver.name());
        Gateway gateway;
        try {
            gateway = driver.connect(port);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new GatewayConnectionException("Interrupted while connecting to " + port, ie);
        } catch (Exception e) {
            throw new GatewayConnectionException("Failed to connect to " + port + ": " + e.getMessage(), e);
        }
        if (gateway == null) {
            throw new GatewayConnectionException("Driver " + driver.name() + " returned no gateway for " + port);
        }
        return gateway;
    }

    static Optional<GatewayDriver> loadDriver() {
        try {
            Iterator<GatewayDriver> it = ServiceLoader.load(GatewayDriver.class).iterator();
            return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
        } catch (ServiceConfigurationError e) {
            log.warn("gateway_driver_load_failed: {}", e.toString());
            return Optional.empty();
        }
    }
}
