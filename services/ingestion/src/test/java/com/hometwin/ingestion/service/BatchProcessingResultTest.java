package com.hometwin.ingestion.service;

import com.hometwin.common.dto.event.BatchProcessingResponse;
import com.hometwin.ingestion.exception.EventProcessingException;
import com.hometwin.ingestion.exception.TwinStoreException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchProcessingResultTest {

    @Test
    void shouldWrapSingleCheckedFailure() {
        IOException cause = new IOException("stream closed");
        BatchProcessingResult result = new BatchProcessingResult(List.of(
                EventOutcome.written(0, "kitchen_temp", EventStatus.APPLIED),
                EventOutcome.failed(1, "hall_temp", cause)));

        assertThatThrownBy(result::throwIfFailed)
                .isInstanceOfSatisfying(EventProcessingException.class, e -> {
                    assertThat(e.getIndex()).isEqualTo(1);
                    assertThat(e).hasCause(cause);
                });
    }

    @Test
    void shouldSummarizeOutcomesInResponse() {
        BatchProcessingResult result = new BatchProcessingResult(List.of(
                EventOutcome.written(0, "kitchen_temp", EventStatus.APPLIED),
                EventOutcome.written(1, "office_temp", EventStatus.CREATED),
                EventOutcome.written(2, "hall_motion", EventStatus.INITIALIZED),
                EventOutcome.skipped(3, "bath_humidity", "device class 'humidity' is not ingested"),
                EventOutcome.failed(4, "hall_temp", new TwinStoreException("hall_temp", "update", 503, "busy"))));

        BatchProcessingResponse response = result.toResponse();

        assertThat(response.status()).isEqualTo("PARTIAL");
        assertThat(response.total()).isEqualTo(5);
        assertThat(response.applied()).isEqualTo(3);
        assertThat(response.skipped()).isEqualTo(1);
        assertThat(response.failed()).isEqualTo(1);
        assertThat(response.errors()).singleElement().satisfies(error -> {
            assertThat(error.index()).isEqualTo(4);
            assertThat(error.twinId()).isEqualTo("hall_temp");
            assertThat(error.message()).contains("status 503");
        });
    }

    @Test
    void responseStatusShouldReflectFailures() {
        BatchProcessingResult ok = new BatchProcessingResult(List.of(
                EventOutcome.skipped(0, null, "no device class")));
        BatchProcessingResult allFailed = new BatchProcessingResult(List.of(
                EventOutcome.failed(0, null, new IllegalStateException("boom"))));

        assertThat(ok.toResponse().status()).isEqualTo("OK");
        assertThat(allFailed.toResponse().status()).isEqualTo("ERROR");
    }
}
