package com.bulk.ingest.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.bulk.common.model.ChunkStatus;
import com.bulk.common.model.ErrorSeverity;
import com.bulk.ingest.config.IngestProperties;
import com.bulk.ingest.model.UploadChunk;
import com.bulk.ingest.pipeline.ChunkResult;
import com.bulk.ingest.pipeline.ChunkWork;
import com.bulk.ingest.pipeline.ChunkWriter;
import com.bulk.ingest.pipeline.InvoiceLine;
import com.bulk.ingest.pipeline.TransientChunkException;
import com.bulk.ingest.repository.UploadChunkRepository;
import com.bulk.ingest.resilience.RetryBackoff;
import com.bulk.ingest.support.MutableClock;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class ChunkProcessorTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private ChunkWriter writer;
    private UploadChunkRepository chunkRepository;
    private SimpleMeterRegistry meterRegistry;
    private ChunkProcessor processor;
    private ChunkWork work;
    private UploadChunk chunk;

    @BeforeEach
    void setUp() {
        writer = mock(ChunkWriter.class);
        chunkRepository = mock(UploadChunkRepository.class);
        meterRegistry = new SimpleMeterRegistry();
        IngestProperties properties = new IngestProperties();
        properties.setMaxRetryAttempts(3);
        processor = new ChunkProcessor(writer, chunkRepository,
                new RetryBackoff(Duration.ofMillis(1), Duration.ofMillis(5)), properties, meterRegistry,
                new MutableClock(NOW));

        UUID uploadId = UUID.randomUUID();
        List<InvoiceLine> lines = List.of(line(11), line(12));
        work = new ChunkWork(uploadId, UUID.randomUUID(), 3, 11, 13, lines);
        chunk = UploadChunk.builder()
                .id(work.chunkId())
                .uploadId(uploadId)
                .chunkIndex(3)
                .status(ChunkStatus.QUEUED)
                .attemptCount(0)
                .build();
    }

    private static InvoiceLine line(long row) {
        return InvoiceLine.builder()
                .rowNumber(row)
                .invoiceNo("INV-" + row)
                .quantity(BigDecimal.ONE)
                .rawFields(Map.of("InvoiceNo", "INV-" + row))
                .build();
    }

    private TransientChunkException transientFailure() {
        return new TransientChunkException(work, new RuntimeException("connection reset"));
    }

    @Test
    @DisplayName("a successful write completes the chunk on the first attempt")
    void firstAttempt() {
        when(writer.write(work)).thenReturn(ChunkResult.builder().inserted(1).duplicates(1).build());

        ChunkOutcome outcome = processor.process(work, chunk);

        assertThat(outcome.status()).isEqualTo(ChunkStatus.COMPLETED);
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(chunk.getInsertedRows()).isEqualTo(1);
        assertThat(chunk.getDuplicateRows()).isEqualTo(1);
        assertThat(meterRegistry.counter("bulk.ingest.chunks.completed", "service", "bulk-ingest").count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("chunk bookkeeping is stamped from the injected clock")
    void stampsFromClock() {
        when(writer.write(work)).thenReturn(ChunkResult.builder().inserted(2).build());

        processor.process(work, chunk);

        assertThat(chunk.getUpdatedAt()).isEqualTo(NOW);
        verify(chunkRepository, times(2)).save(chunk);
    }

    @Test
    @DisplayName("transient failures are retried until the write goes through")
    void retriesTransient() {
        when(writer.write(work))
                .thenThrow(transientFailure())
                .thenThrow(transientFailure())
                .thenReturn(ChunkResult.builder().inserted(2).build());

        ChunkOutcome outcome = processor.process(work, chunk);

        assertThat(outcome.status()).isEqualTo(ChunkStatus.COMPLETED);
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(chunk.getAttemptCount()).isEqualTo(3);
        assertThat(meterRegistry.counter("bulk.ingest.chunks.retried", "service", "bulk-ingest").count())
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("the chunk is dead-lettered once every attempt failed transiently")
    void deadLetters() {
        when(writer.write(work)).thenThrow(transientFailure());

        ChunkOutcome outcome = processor.process(work, chunk);

        assertThat(outcome.isDeadLettered()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(outcome.result().getFailed()).isEqualTo(2);
        assertThat(outcome.result().getErrors())
                .extracting(error -> error.rowNumber(), error -> error.severity())
                .containsExactly(
                        tuple(11L, ErrorSeverity.TRANSIENT),
                        tuple(12L, ErrorSeverity.TRANSIENT));
        assertThat(chunk.getStatus()).isEqualTo(ChunkStatus.DEAD_LETTERED);
        assertThat(chunk.getLastError()).contains("connection reset");
        verify(writer, times(3)).write(work);
    }

    @Test
    @DisplayName("an unexpected failure dead-letters at once with fatal row errors")
    void unexpectedFailure() {
        when(writer.write(work)).thenThrow(new IllegalStateException("bug"));

        ChunkOutcome outcome = processor.process(work, chunk);

        assertThat(outcome.isDeadLettered()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(outcome.result().getErrors()).allSatisfy(error -> {
            assertThat(error.severity()).isEqualTo(ErrorSeverity.FATAL);
            assertThat(error.message()).contains("bug");
        });
    }

    @Test
    @DisplayName("losing a chunk bookkeeping update does not fail the chunk")
    void bookkeepingFailure() {
        when(chunkRepository.save(any(UploadChunk.class))).thenThrow(new IllegalStateException("db down"));
        when(writer.write(work)).thenReturn(ChunkResult.builder().inserted(2).build());

        ChunkOutcome outcome = processor.process(work, chunk);

        assertThat(outcome.status()).isEqualTo(ChunkStatus.COMPLETED);
    }
}
