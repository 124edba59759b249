package com.hometwin.ingestion.listener;

import com.hometwin.ingestion.exception.BatchProcessingException;
import com.hometwin.ingestion.exception.MalformedEventException;
import com.hometwin.ingestion.service.BatchProcessingResult;
import com.hometwin.ingestion.service.EventBatchProcessor;
import com.hometwin.ingestion.service.EventOutcome;
import com.hometwin.ingestion.service.EventStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SensorStateListenerTest {

    private static final List<String> BATCH = List.of("{}", "{}", "{}");

    private EventBatchProcessor processor;
    private SensorStateListener listener;

    @BeforeEach
    void setUp() {
        processor = Mockito.mock(EventBatchProcessor.class);
        listener = new SensorStateListener(processor);
    }

    @Test
    void shouldAcceptBatchWithoutFailures() {
        when(processor.process(BATCH)).thenReturn(new BatchProcessingResult(List.of(
                EventOutcome.written(0, "a", EventStatus.APPLIED),
                EventOutcome.skipped(1, "b", "no device class"),
                EventOutcome.written(2, "c", EventStatus.CREATED))));

        assertThatCode(() -> listener.onBatch(BATCH)).doesNotThrowAnyException();
        verify(processor).process(BATCH);
    }

    @Test
    void shouldRethrowSingleFailure() {
        MalformedEventException failure = new MalformedEventException("Invalid last_changed 'x'", null);
        when(processor.process(BATCH)).thenReturn(new BatchProcessingResult(List.of(
                EventOutcome.written(0, "a", EventStatus.APPLIED),
                EventOutcome.failed(1, "b", failure),
                EventOutcome.written(2, "c", EventStatus.APPLIED))));

        assertThatThrownBy(() -> listener.onBatch(BATCH)).isSameAs(failure);
    }

    @Test
    void shouldAggregateSeveralFailures() {
        when(processor.process(BATCH)).thenReturn(new BatchProcessingResult(List.of(
                EventOutcome.failed(0, "a", new IllegalStateException("one")),
                EventOutcome.written(1, "b", EventStatus.APPLIED),
                EventOutcome.failed(2, "c", new IllegalStateException("two")))));

        assertThatThrownBy(() -> listener.onBatch(BATCH))
                .isInstanceOf(BatchProcessingException.class)
                .hasMessage("2 of 3 events failed");
    }
}
