package com.hometwin.common.model.reading;

/**
 * Numeric reading, used for illuminance (lx) and temperature sensors.
 */
public record NumericReading(double value) implements SensorReading {

    @Override
    public Double twinValue() {
        return value;
    }

    public static NumericReading of(double value) {
        return new NumericReading(value);
    }
}
