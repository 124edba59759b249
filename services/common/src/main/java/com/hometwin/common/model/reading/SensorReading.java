package com.hometwin.common.model.reading;

import com.hometwin.common.model.DeviceClassRule;

import java.math.BigDecimal;

/**
 * Sealed interface for a sensor state after classification.
 * Decided once per event, then matched when the twin update is built.
 */
public sealed interface SensorReading permits NumericReading, BooleanReading, Unmapped {

    /**
     * Returns the value written to the twin's {@code lastKnownValue/value} property.
     *
     * @throws IllegalStateException for {@link Unmapped}
     */
    Object twinValue();

    /**
     * Maps a raw Home Assistant state string according to the device class rule.
     */
    static SensorReading from(DeviceClassRule rule, String state) {
        return switch (rule.valueKind()) {
            case NUMERIC -> parseNumeric(state);
            case ON_OFF -> BooleanReading.of("on".equalsIgnoreCase(state));
        };
    }

    private static SensorReading parseNumeric(String state) {
        if (state == null || state.isBlank()) {
            return Unmapped.because("empty state");
        }
        try {
            // BigDecimal rejects NaN, Infinity, hex and type suffixes that Double.parseDouble accepts
            double value = new BigDecimal(state.strip()).doubleValue();
            if (!Double.isFinite(value)) {
                return Unmapped.because("state '" + state + "' is out of range");
            }
            return NumericReading.of(value);
        } catch (NumberFormatException e) {
            return Unmapped.because("state '" + state + "' is not numeric");
        }
    }
}
