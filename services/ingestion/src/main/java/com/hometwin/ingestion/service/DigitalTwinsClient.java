package com.hometwin.ingestion.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.hometwin.common.dto.twin.TwinDocument;
import com.hometwin.common.dto.twin.TwinPatch;
import com.hometwin.common.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * {@link TwinStore} backed by the Azure Digital Twins data plane REST API.
 * <p>
 * Calls block until the response arrives or the timeout expires; the processor handles one
 * event at a time.
 */
@Service
@Slf4j
public class DigitalTwinsClient implements TwinStore {

    static final MediaType JSON_PATCH = MediaType.valueOf("application/json-patch+json");

    /** Error code returned when a patch operation targets a path the twin does not have. */
    static final String JSON_PATCH_INVALID = "JsonPatchInvalid";

    private final WebClient twinStoreWebClient;
    private final String apiVersion;
    private final Duration timeout;

    public DigitalTwinsClient(
            WebClient twinStoreWebClient,
            @Value("${app.twin-store.api-version:2023-10-31}") String apiVersion,
            @Value("${app.twin-store.timeout:5s}") Duration timeout) {
        this.twinStoreWebClient = twinStoreWebClient;
        this.apiVersion = apiVersion;
        this.timeout = timeout;
    }

    @Override
    public TwinStoreResponse updateTwin(String twinId, TwinPatch patch) {
        return execute("update", twinId, twinStoreWebClient.patch()
                .uri(uri -> uri.path("/digitaltwins/{id}")
                        .queryParam("api-version", apiVersion)
                        .build(twinId))
                .contentType(JSON_PATCH)
                .bodyValue(JsonUtil.toJson(patch)));
    }

    @Override
    public TwinStoreResponse createOrReplaceTwin(String twinId, TwinDocument document) {
        return execute("create", twinId, twinStoreWebClient.put()
                .uri(uri -> uri.path("/digitaltwins/{id}")
                        .queryParam("api-version", apiVersion)
                        .build(twinId))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(JsonUtil.toJson(document)));
    }

    private TwinStoreResponse execute(String operation, String twinId, WebClient.RequestHeadersSpec<?> request) {
        TwinStoreResponse response = request
                .exchangeToMono(this::toResponse)
                .timeout(timeout)
                .onErrorResume(e -> {
                    log.warn("Twin {} of '{}' did not complete: {}", operation, twinId, e.toString());
                    return Mono.just(new TwinStoreResponse.OtherError(0, e.toString()));
                })
                .block();
        log.debug("Twin {} of '{}' returned {}", operation, twinId, response);
        return response;
    }

    private Mono<TwinStoreResponse> toResponse(ClientResponse response) {
        if (response.statusCode().is2xxSuccessful()) {
            return response.releaseBody().thenReturn(TwinStoreResponse.APPLIED);
        }
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> classify(status, body));
    }

    /**
     * Maps an error status and body to a response variant.
     */
    static TwinStoreResponse classify(int status, String body) {
        if (status == HttpStatus.NOT_FOUND.value()) {
            return TwinStoreResponse.NOT_FOUND;
        }
        ErrorBody error = ErrorBody.parse(body);
        if (status == HttpStatus.BAD_REQUEST.value() && JSON_PATCH_INVALID.equals(error.code())) {
            return TwinStoreResponse.FIELD_NOT_INITIALIZED;
        }
        return new TwinStoreResponse.OtherError(status, error.describe());
    }

    /**
     * Error payload of the form {@code {"error": {"code": "...", "message": "..."}}}.
     */
    record ErrorBody(String code, String message, String raw) {

        static ErrorBody parse(String body) {
            if (body == null || body.isBlank()) {
                return new ErrorBody(null, null, "");
            }
            try {
                JsonNode error = JsonUtil.getObjectMapper().readTree(body).path("error");
                return new ErrorBody(
                        error.path("code").isTextual() ? error.path("code").asText() : null,
                        error.path("message").isTextual() ? error.path("message").asText() : null,
                        body);
            } catch (JsonProcessingException e) {
                return new ErrorBody(null, null, body);
            }
        }

        String describe() {
            if (code == null) {
                return raw.isEmpty() ? "no response body" : raw;
            }
            return message == null ? code : code + ": " + message;
        }
    }
}
