package com.elssolution.insteonbridge.gateway;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/** Arguments for a {@link DeviceOperation}; absent values are simply not passed on. */
@Value
@Builder
public class OperationArgs {

    public static final OperationArgs NONE = OperationArgs.builder().build();

    /** Device scale, 0..255. */
    Integer level;

    /** Ramp duration in seconds. */
    Double duration;

    public Optional<Integer> level() {
        return Optional.ofNullable(level);
    }

    public Optional<Double> duration() {
        return Optional.ofNullable(duration);
    }
}
