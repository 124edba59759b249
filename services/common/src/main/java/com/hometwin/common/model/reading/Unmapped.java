package com.hometwin.common.model.reading;

/**
 * State that could not be mapped for its device class. Events carrying one are skipped.
 */
public record Unmapped(String reason) implements SensorReading {

    @Override
    public Object twinValue() {
        throw new IllegalStateException("Unmapped reading has no twin value: " + reason);
    }

    public static Unmapped because(String reason) {
        return new Unmapped(reason);
    }
}
