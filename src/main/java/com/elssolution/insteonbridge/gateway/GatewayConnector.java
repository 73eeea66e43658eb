package com.elssolution.insteonbridge.gateway;

import com.elssolution.insteonbridge.exception.GatewayConnectionException;

/** Opens a gateway on a serial port. Blocking; called from the supervisor thread. */
public interface GatewayConnector {

    Gateway connect(String port) throws GatewayConnectionException;
}
