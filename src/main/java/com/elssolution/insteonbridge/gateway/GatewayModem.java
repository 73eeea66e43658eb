package com.elssolution.insteonbridge.gateway;

import java.util.concurrent.CompletableFuture;

/** The PLM itself. It is listed among the gateway devices but never registered as one. */
public interface GatewayModem {

    String address();

    CompletableFuture<Void> close();
}
