package com.hometwin.ingestion.exception;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by the REST endpoints.
 */
public record ErrorResponse(
    @JsonProperty("status")
    int status,

    @JsonProperty("error")
    String error,

    @JsonProperty("message")
    String message,

    @JsonProperty("path")
    String path,

    @JsonProperty("timestamp")
    Instant timestamp,

    @JsonProperty("details")
    List<String> details
) {
    public static ErrorResponse of(HttpStatus status, String message, String path) {
        return of(status, message, path, List.of());
    }

    public static ErrorResponse of(HttpStatus status, String message, String path, List<String> details) {
        return new ErrorResponse(status.value(), status.getReasonPhrase(), message, path, Instant.now(), List.copyOf(details));
    }
}
