package com.hometwin.common.dto.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Batch of raw sensor state events submitted over HTTP, for replaying events that were
 * reported as failed.
 *
 * Example JSON:
 * {
 *   "events": [
 *     {"entity_id": "sensor.kitchen_temp", "state": "21.5", ...},
 *     {"entity_id": "binary_sensor.hall_motion", "state": "on", ...}
 *   ]
 * }
 *
 * Events are kept as raw JSON so that each one is parsed, and can fail, on its own.
 */
public record EventBatchRequest(
    @NotEmpty(message = "Events list cannot be empty")
    @Size(max = 1000, message = "Maximum 1000 events per batch")
    @JsonProperty("events")
    List<JsonNode> events
) {
    @JsonCreator
    public EventBatchRequest(
        @JsonProperty("events") List<JsonNode> events
    ) {
        this.events = events != null ? List.copyOf(events) : List.of();
    }

    public int size() {
        return events.size();
    }

    /**
     * Returns each event re-serialized as the payload text the stream would have delivered.
     */
    public List<String> payloads() {
        return events.stream()
            .map(JsonNode::toString)
            .toList();
    }
}
