package com.hometwin.ingestion.controller;

import com.hometwin.common.dto.event.BatchProcessingResponse;
import com.hometwin.common.dto.event.EventBatchRequest;
import com.hometwin.ingestion.service.BatchProcessingResult;
import com.hometwin.ingestion.service.EventBatchProcessor;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * REST controller for submitting sensor state events outside the stream, e.g. to replay a
 * batch that was reported as failed.
 *
 * Endpoints:
 * - POST /api/v1/events/batch - Batch of raw Home Assistant state events
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventIngestController {

    private static final Logger log = LoggerFactory.getLogger(EventIngestController.class);

    private final EventBatchProcessor eventBatchProcessor;

    public EventIngestController(EventBatchProcessor eventBatchProcessor) {
        this.eventBatchProcessor = eventBatchProcessor;
    }

    /**
     * Process a batch of events and report the outcome of each one.
     */
    @PostMapping(
            path = "/batch",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public Mono<ResponseEntity<BatchProcessingResponse>> ingestBatch(
            @Valid @RequestBody EventBatchRequest request) {

        log.debug("Received event batch: count={}", request.size());

        // Twin store calls block, keep them off the event loop
        return Mono.fromCallable(() -> eventBatchProcessor.process(request.payloads()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(BatchProcessingResult::toResponse)
                .map(response -> switch (response.status()) {
                    case "OK" -> ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
                    case "PARTIAL" -> ResponseEntity.status(HttpStatus.MULTI_STATUS).body(response);
                    default -> ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
                });
    }

    /**
     * Health check endpoint for simple connectivity test.
     */
    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
