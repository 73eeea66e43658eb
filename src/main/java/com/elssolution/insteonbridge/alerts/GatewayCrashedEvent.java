package com.elssolution.insteonbridge.alerts;

/** A gateway or driver thread died; whoever holds the connection should reopen it. */
public record GatewayCrashedEvent(Throwable cause) {
}
