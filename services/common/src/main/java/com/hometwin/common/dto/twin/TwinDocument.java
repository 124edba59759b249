package com.hometwin.common.dto.twin;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a create-or-replace twin request.
 *
 * Example JSON:
 * {
 *   "$dtId": "kitchen_temp",
 *   "$metadata": {"$model": "dtmi:com:hometwin:TemperatureSensor;1"},
 *   "lastKnownValue": {"value": 21.5, "timestamp": "2024-01-01T00:00:00Z"}
 * }
 */
public record TwinDocument(
    @JsonProperty("$dtId")
    String dtId,

    @JsonProperty("$metadata")
    Metadata metadata,

    @JsonProperty("lastKnownValue")
    LastKnownValue lastKnownValue
) {
    public record Metadata(
        @JsonProperty("$model")
        String model
    ) {}

    public static TwinDocument of(String twinId, String modelId, LastKnownValue lastKnownValue) {
        return new TwinDocument(twinId, new Metadata(modelId), lastKnownValue);
    }
}
