package com.hometwin.common.model.reading;

/**
 * On/off reading, used for motion sensors.
 */
public record BooleanReading(boolean active) implements SensorReading {

    private static final BooleanReading ON = new BooleanReading(true);
    private static final BooleanReading OFF = new BooleanReading(false);

    @Override
    public Boolean twinValue() {
        return active;
    }

    public static BooleanReading of(boolean active) {
        return active ? ON : OFF;
    }
}
