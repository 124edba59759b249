package com.hometwin.common.dto.twin;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hometwin.common.model.reading.SensorReading;

import java.time.Instant;
import java.util.Objects;

/**
 * The twin-side {@code lastKnownValue} property: the most recent reading and when it changed.
 * {@code value} is a {@link Double} or a {@link Boolean}.
 */
public record LastKnownValue(
    @JsonProperty("value")
    Object value,

    @JsonProperty("timestamp")
    Instant timestamp
) {
    public LastKnownValue {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /**
     * @throws IllegalStateException if the reading is unmapped
     */
    public static LastKnownValue of(SensorReading reading, Instant timestamp) {
        return new LastKnownValue(reading.twinValue(), timestamp);
    }
}
