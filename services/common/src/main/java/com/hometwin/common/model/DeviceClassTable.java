package com.hometwin.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup of the device classes that are ingested. Anything not in the table is
 * skipped by the processor.
 */
public final class DeviceClassTable {

    public static final String ILLUMINANCE_MODEL = "dtmi:com:hometwin:IlluminanceSensor;1";
    public static final String TEMPERATURE_MODEL = "dtmi:com:hometwin:TemperatureSensor;1";
    public static final String MOTION_MODEL = "dtmi:com:hometwin:MotionSensor;1";

    private static final DeviceClassTable DEFAULTS = of(
        DeviceClassRule.numeric("illuminance", ILLUMINANCE_MODEL),
        DeviceClassRule.numeric("temperature", TEMPERATURE_MODEL),
        DeviceClassRule.onOff("motion", MOTION_MODEL)
    );

    private final Map<String, DeviceClassRule> rules;

    private DeviceClassTable(Map<String, DeviceClassRule> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    /**
     * The fixed production table: illuminance and temperature are numeric, motion is on/off.
     */
    public static DeviceClassTable defaults() {
        return DEFAULTS;
    }

    public static DeviceClassTable of(DeviceClassRule... rules) {
        Map<String, DeviceClassRule> byClass = new LinkedHashMap<>();
        for (DeviceClassRule rule : rules) {
            if (byClass.put(rule.deviceClass(), rule) != null) {
                throw new IllegalArgumentException("Duplicate device class: " + rule.deviceClass());
            }
        }
        return new DeviceClassTable(byClass);
    }

    /**
     * Exact, case-sensitive lookup.
     */
    public Optional<DeviceClassRule> find(String deviceClass) {
        if (deviceClass == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rules.get(deviceClass));
    }

    @Override
    public String toString() {
        return "DeviceClassTable" + rules.keySet();
    }
}
