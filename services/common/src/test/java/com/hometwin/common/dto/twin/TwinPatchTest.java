package com.hometwin.common.dto.twin;

import com.fasterxml.jackson.databind.JsonNode;
import com.hometwin.common.util.JsonUtil;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TwinPatchTest {

    private static final LastKnownValue READING =
            new LastKnownValue(21.5, Instant.parse("2024-01-01T00:00:00Z"));

    @Test
    void replaceShouldTargetValueAndTimestamp() throws Exception {
        JsonNode json = toTree(TwinPatch.replaceLastKnownValue(READING));

        assertThat(json.isArray()).isTrue();
        assertThat(json).hasSize(2);
        assertThat(json.get(0).get("op").asText()).isEqualTo("replace");
        assertThat(json.get(0).get("path").asText()).isEqualTo("/lastKnownValue/value");
        assertThat(json.get(0).get("value").asDouble()).isEqualTo(21.5);
        assertThat(json.get(1).get("op").asText()).isEqualTo("replace");
        assertThat(json.get(1).get("path").asText()).isEqualTo("/lastKnownValue/timestamp");
        assertThat(json.get(1).get("value").asText()).isEqualTo("2024-01-01T00:00:00Z");
    }

    @Test
    void initializeShouldAddWholeComponent() throws Exception {
        LastKnownValue motion = new LastKnownValue(true, Instant.parse("2024-01-01T00:00:00Z"));

        JsonNode json = toTree(TwinPatch.initializeLastKnownValue(motion));

        assertThat(json).hasSize(1);
        assertThat(json.get(0).get("op").asText()).isEqualTo("add");
        assertThat(json.get(0).get("path").asText()).isEqualTo("/lastKnownValue");
        assertThat(json.get(0).get("value").get("value").asBoolean()).isTrue();
        assertThat(json.get(0).get("value").get("timestamp").asText()).isEqualTo("2024-01-01T00:00:00Z");
    }

    @Test
    void twinDocumentShouldCarryModelAndLastKnownValue() throws Exception {
        TwinDocument document = TwinDocument.of("kitchen_temp", "dtmi:com:hometwin:TemperatureSensor;1", READING);

        JsonNode json = toTree(document);

        assertThat(json.get("$dtId").asText()).isEqualTo("kitchen_temp");
        assertThat(json.get("$metadata").get("$model").asText()).isEqualTo("dtmi:com:hometwin:TemperatureSensor;1");
        assertThat(json.get("lastKnownValue").get("value").asDouble()).isEqualTo(21.5);
        assertThat(json.get("lastKnownValue").get("timestamp").asText()).isEqualTo("2024-01-01T00:00:00Z");
    }

    private static JsonNode toTree(Object value) throws Exception {
        return JsonUtil.getObjectMapper().readTree(JsonUtil.toJson(value));
    }
}
