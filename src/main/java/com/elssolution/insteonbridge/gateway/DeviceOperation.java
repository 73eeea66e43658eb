package com.elssolution.insteonbridge.gateway;

import java.util.concurrent.CompletionStage;

/** One capability method of a device (turn_on, fast_off, status_request, ...). */
@FunctionalInterface
public interface DeviceOperation {

    CompletionStage<?> invoke(OperationArgs args) throws Exception;
}
