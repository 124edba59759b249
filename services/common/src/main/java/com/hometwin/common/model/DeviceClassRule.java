package com.hometwin.common.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Classification of one Home Assistant device class: how its state is read and which
 * twin model describes sensors of that class.
 *
 * @param deviceClass the {@code attributes.device_class} value, e.g. {@code temperature}
 * @param valueKind   how the state string is mapped
 * @param modelId     DTDL model identifier used when a twin has to be created, may be {@code null}
 */
public record DeviceClassRule(
    String deviceClass,
    ValueKind valueKind,
    String modelId
) {
    public DeviceClassRule {
        Objects.requireNonNull(deviceClass, "deviceClass");
        Objects.requireNonNull(valueKind, "valueKind");
    }

    public static DeviceClassRule numeric(String deviceClass, String modelId) {
        return new DeviceClassRule(deviceClass, ValueKind.NUMERIC, modelId);
    }

    public static DeviceClassRule onOff(String deviceClass, String modelId) {
        return new DeviceClassRule(deviceClass, ValueKind.ON_OFF, modelId);
    }

    public Optional<String> model() {
        return Optional.ofNullable(modelId);
    }
}
