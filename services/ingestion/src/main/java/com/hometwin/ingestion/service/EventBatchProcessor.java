package com.hometwin.ingestion.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.hometwin.common.dto.event.SensorStateEvent;
import com.hometwin.common.dto.twin.LastKnownValue;
import com.hometwin.common.dto.twin.TwinDocument;
import com.hometwin.common.dto.twin.TwinPatch;
import com.hometwin.common.model.DeviceClassRule;
import com.hometwin.common.model.DeviceClassTable;
import com.hometwin.common.model.EntityId;
import com.hometwin.common.model.reading.SensorReading;
import com.hometwin.common.model.reading.Unmapped;
import com.hometwin.common.util.JsonUtil;
import com.hometwin.ingestion.exception.MalformedEventException;
import com.hometwin.ingestion.exception.MissingModelIdentifierException;
import com.hometwin.ingestion.exception.TwinStoreException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies batches of Home Assistant sensor state events to their digital twins.
 * <p>
 * Events are handled one at a time, in batch order. A failing event never stops the batch:
 * its error is recorded in the returned {@link BatchProcessingResult} and the next event is
 * processed.
 */
@Service
public class EventBatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(EventBatchProcessor.class);

    private final TwinStore twinStore;
    private final DeviceClassTable deviceClasses;

    // Metrics
    private final Counter eventsReceived;
    private final Counter eventsApplied;
    private final Counter eventsSkipped;
    private final Counter eventsFailed;
    private final Timer updateLatency;

    public EventBatchProcessor(
            TwinStore twinStore,
            DeviceClassTable deviceClasses,
            MeterRegistry meterRegistry) {
        this.twinStore = twinStore;
        this.deviceClasses = deviceClasses;

        this.eventsReceived = Counter.builder("ingestion.events.received")
                .description("Number of sensor state events received")
                .register(meterRegistry);

        this.eventsApplied = Counter.builder("ingestion.events.applied")
                .description("Number of events written to a twin")
                .register(meterRegistry);

        this.eventsSkipped = Counter.builder("ingestion.events.skipped")
                .description("Number of events with nothing to apply")
                .register(meterRegistry);

        this.eventsFailed = Counter.builder("ingestion.events.failed")
                .description("Number of events that failed to apply")
                .register(meterRegistry);

        this.updateLatency = Timer.builder("ingestion.twin.update.latency")
                .description("Time taken by twin store calls")
                .register(meterRegistry);
    }

    /**
     * Process a batch of raw event payloads.
     */
    public BatchProcessingResult process(List<String> payloads) {
        eventsReceived.increment(payloads.size());

        List<EventOutcome> outcomes = new ArrayList<>(payloads.size());
        for (int index = 0; index < payloads.size(); index++) {
            outcomes.add(processEvent(index, payloads.get(index)));
        }

        BatchProcessingResult result = new BatchProcessingResult(outcomes);
        if (result.hasFailures()) {
            log.error("Processed batch with failures: {}", result);
        } else {
            log.info("Processed batch: {}", result);
        }
        return result;
    }

    /**
     * Process a single event. Never throws; errors become a {@link EventStatus#FAILED} outcome.
     */
    EventOutcome processEvent(int index, String payload) {
        String twinId = null;
        try {
            log.info("Processing incoming message: {}", payload);

            SensorStateEvent event = parse(payload);
            if (!event.hasRequiredFields()) {
                return skip(index, null, "missing one of entity_id, state, attributes, last_changed");
            }

            twinId = resolveEntityId(event).twinId();
            Instant lastChanged = resolveTimestamp(event);

            Optional<String> deviceClass = event.deviceClass();
            if (deviceClass.isEmpty()) {
                return skip(index, twinId, "no device class");
            }

            Optional<DeviceClassRule> rule = deviceClasses.find(deviceClass.get());
            if (rule.isEmpty()) {
                return skip(index, twinId, "device class '" + deviceClass.get() + "' is not ingested");
            }

            SensorReading reading = SensorReading.from(rule.get(), event.state());
            if (reading instanceof Unmapped unmapped) {
                return skip(index, twinId, unmapped.reason());
            }

            EventStatus status = applyToTwin(twinId, rule.get(), LastKnownValue.of(reading, lastChanged));
            eventsApplied.increment();
            return EventOutcome.written(index, twinId, status);
        } catch (Exception e) {
            // Keep processing the rest of the batch
            eventsFailed.increment();
            log.error("Failed to process event {} for twin '{}': {}", index, twinId, e.getMessage(), e);
            return EventOutcome.failed(index, twinId, e);
        }
    }

    private EventStatus applyToTwin(String twinId, DeviceClassRule rule, LastKnownValue lastKnownValue) {
        TwinPatch patch = TwinPatch.replaceLastKnownValue(lastKnownValue);
        log.info("Updating twin '{}' with operation '{}'", twinId, JsonUtil.toJson(patch));

        TwinStoreResponse response = updateLatency.record(() -> twinStore.updateTwin(twinId, patch));
        if (response instanceof TwinStoreResponse.Applied) {
            return EventStatus.APPLIED;
        }
        if (response instanceof TwinStoreResponse.NotFound) {
            return createTwin(twinId, rule, lastKnownValue);
        }
        if (response instanceof TwinStoreResponse.FieldNotInitialized) {
            return initializeLastKnownValue(twinId, lastKnownValue);
        }
        throw failure(twinId, "update", response);
    }

    private EventStatus createTwin(String twinId, DeviceClassRule rule, LastKnownValue lastKnownValue) {
        String modelId = rule.model()
                .orElseThrow(() -> new MissingModelIdentifierException(rule.deviceClass(), twinId));

        log.warn("Twin '{}' not found, creating it with model {}", twinId, modelId);
        TwinDocument document = TwinDocument.of(twinId, modelId, lastKnownValue);

        TwinStoreResponse response = updateLatency.record(() -> twinStore.createOrReplaceTwin(twinId, document));
        if (response instanceof TwinStoreResponse.Applied) {
            return EventStatus.CREATED;
        }
        throw failure(twinId, "create", response);
    }

    private EventStatus initializeLastKnownValue(String twinId, LastKnownValue lastKnownValue) {
        log.warn("Twin '{}' has no lastKnownValue yet, adding it", twinId);
        TwinPatch patch = TwinPatch.initializeLastKnownValue(lastKnownValue);

        TwinStoreResponse response = updateLatency.record(() -> twinStore.updateTwin(twinId, patch));
        if (response instanceof TwinStoreResponse.Applied) {
            return EventStatus.INITIALIZED;
        }
        throw failure(twinId, "initialize", response);
    }

    private EventOutcome skip(int index, String twinId, String reason) {
        eventsSkipped.increment();
        log.debug("Skipping event {} for twin '{}': {}", index, twinId, reason);
        return EventOutcome.skipped(index, twinId, reason);
    }

    private static SensorStateEvent parse(String payload) {
        if (payload == null) {
            throw new MalformedEventException("Empty event payload", null);
        }
        try {
            SensorStateEvent event = JsonUtil.fromJson(payload, SensorStateEvent.class);
            if (event == null) {
                throw new MalformedEventException("Event payload is JSON null", null);
            }
            return event;
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Event payload is not a valid state object: " + e.getOriginalMessage(), e);
        }
    }

    private static EntityId resolveEntityId(SensorStateEvent event) {
        try {
            return EntityId.parse(event.entityId());
        } catch (IllegalArgumentException e) {
            throw new MalformedEventException(e.getMessage(), e);
        }
    }

    private static Instant resolveTimestamp(SensorStateEvent event) {
        try {
            return event.lastChangedAt();
        } catch (DateTimeParseException e) {
            throw new MalformedEventException("Invalid last_changed '" + event.lastChanged() + "'", e);
        }
    }

    private static TwinStoreException failure(String twinId, String operation, TwinStoreResponse response) {
        if (response instanceof TwinStoreResponse.OtherError error) {
            return new TwinStoreException(twinId, operation, error.status(), error.detail());
        }
        // e.g. NotFound answering a create
        return new TwinStoreException(twinId, operation, 0, "unexpected response " + response);
    }
}
