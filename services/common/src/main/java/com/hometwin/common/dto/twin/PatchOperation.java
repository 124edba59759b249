package com.hometwin.common.dto.twin;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A single RFC 6902 JSON Patch operation.
 */
public record PatchOperation(
    @JsonProperty("op")
    Op op,

    @JsonProperty("path")
    String path,

    @JsonProperty("value")
    Object value
) {
    public enum Op {
        ADD("add"),
        REPLACE("replace");

        private final String value;

        Op(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    public static PatchOperation add(String path, Object value) {
        return new PatchOperation(Op.ADD, path, value);
    }

    public static PatchOperation replace(String path, Object value) {
        return new PatchOperation(Op.REPLACE, path, value);
    }
}
