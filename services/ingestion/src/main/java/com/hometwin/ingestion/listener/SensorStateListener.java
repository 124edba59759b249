package com.hometwin.ingestion.listener;

import com.hometwin.ingestion.service.BatchProcessingResult;
import com.hometwin.ingestion.service.EventBatchProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Receives sensor state batches from Kafka.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SensorStateListener {

    private final EventBatchProcessor eventBatchProcessor;

    /**
     * Processes every event of the batch, then rethrows the failures (if any) so the container's
     * error handler records them.
     */
    @KafkaListener(
            id = "sensor-state",
            topics = "${app.kafka.topic.sensor-state}",
            batch = "true")
    public void onBatch(List<String> payloads) {
        log.debug("Received sensor state batch: count={}", payloads.size());

        BatchProcessingResult result = eventBatchProcessor.process(payloads);
        result.throwIfFailed();
    }
}
