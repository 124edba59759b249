package com.hometwin.common.dto.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

/**
 * Home Assistant state object as forwarded to the event stream.
 *
 * Example JSON:
 * {
 *   "entity_id": "sensor.kitchen_temp",
 *   "state": "21.5",
 *   "attributes": {"device_class": "temperature", "unit_of_measurement": "°C"},
 *   "last_changed": "2024-01-01T00:00:00Z",
 *   "last_updated": "2024-01-01T00:00:00Z"
 * }
 *
 * Only {@code last_changed} is read as the reading's timestamp. Other fields such as
 * {@code last_updated} and {@code context} are ignored.
 */
public record SensorStateEvent(
    @JsonProperty("entity_id")
    String entityId,

    @JsonProperty("state")
    String state,

    @JsonProperty("attributes")
    Map<String, Object> attributes,

    @JsonProperty("last_changed")
    String lastChanged
) {
    public static final String DEVICE_CLASS = "device_class";

    // yyyy-MM-dd
    private static final int DATE_LENGTH = 10;

    @JsonCreator
    public SensorStateEvent(
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("state") String state,
        @JsonProperty("attributes") Map<String, Object> attributes,
        @JsonProperty("last_changed") String lastChanged
    ) {
        this.entityId = entityId;
        this.state = state;
        this.attributes = attributes;
        this.lastChanged = lastChanged;
    }

    /**
     * Presence check for the fields the processor needs.
     */
    public boolean hasRequiredFields() {
        return entityId != null && state != null && attributes != null && lastChanged != null;
    }

    public Optional<String> deviceClass() {
        if (attributes == null) {
            return Optional.empty();
        }
        Object value = attributes.get(DEVICE_CLASS);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    /**
     * Parses {@code last_changed}. Accepts ISO-8601 with an offset; a date-time without offset
     * is taken as UTC. The date and time may also be separated by a space, as in
     * {@code 2024-01-01 00:00:00+00:00}.
     *
     * @throws DateTimeParseException if the value is not a timestamp
     */
    public Instant lastChangedAt() {
        String text = lastChanged.strip();
        if (text.length() > DATE_LENGTH && text.charAt(DATE_LENGTH) == ' ') {
            text = text.substring(0, DATE_LENGTH) + 'T' + text.substring(DATE_LENGTH + 1);
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        }
    }
}
