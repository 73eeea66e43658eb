package com.elssolution.insteonbridge.gateway;

/**
 * Service-provider hook for the protocol library that actually talks to the PLM.
 * Registered through {@code META-INF/services/com.elssolution.insteonbridge.gateway.GatewayDriver}.
 */
public interface GatewayDriver {

    String name();

    Gateway connect(String port) throws Exception;
}
