package com.elssolution.insteonbridge.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/** Read-only copy of the process-wide bridge status. Never persisted. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.ALWAYS)
public class BridgeStatus {
    boolean connected;
    String port;
    String state;
    int connectAttempts;
    int successfulConnects;
    String lastError;
    int deviceCount;
    String lastDiscovery;      // ISO-8601, null before the first discovery
    boolean mockMode;
    int subscribers;
}
