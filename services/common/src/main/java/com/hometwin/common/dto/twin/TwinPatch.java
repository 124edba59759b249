package com.hometwin.common.dto.twin;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * JSON Patch document sent to update a twin. Serializes as the bare array of operations.
 */
public record TwinPatch(List<PatchOperation> operations) {

    public static final String LAST_KNOWN_VALUE = "/lastKnownValue";
    public static final String LAST_KNOWN_VALUE_VALUE = LAST_KNOWN_VALUE + "/value";
    public static final String LAST_KNOWN_VALUE_TIMESTAMP = LAST_KNOWN_VALUE + "/timestamp";

    public TwinPatch {
        operations = List.copyOf(operations);
    }

    /**
     * Regular update: replaces value and timestamp inside an existing {@code lastKnownValue}.
     */
    public static TwinPatch replaceLastKnownValue(LastKnownValue lastKnownValue) {
        return new TwinPatch(List.of(
            PatchOperation.replace(LAST_KNOWN_VALUE_VALUE, lastKnownValue.value()),
            PatchOperation.replace(LAST_KNOWN_VALUE_TIMESTAMP, lastKnownValue.timestamp())
        ));
    }

    /**
     * Update for a twin that exists but has never had {@code lastKnownValue} set: adds the
     * whole component in one operation.
     */
    public static TwinPatch initializeLastKnownValue(LastKnownValue lastKnownValue) {
        return new TwinPatch(List.of(
            PatchOperation.add(LAST_KNOWN_VALUE, lastKnownValue)
        ));
    }

    @JsonValue
    public List<PatchOperation> operations() {
        return operations;
    }
}
