package com.bulk.ingest.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.bulk.common.model.ErrorSeverity;
import com.bulk.ingest.resilience.CircuitBreaker;
import com.bulk.ingest.resilience.CircuitOpenException;
import com.bulk.ingest.resilience.FailureClassifier;
import com.bulk.ingest.resilience.ResourcePoolManager;
import com.bulk.ingest.support.InMemoryWarehouse;
import com.bulk.ingest.support.MutableClock;

class ChunkWriterTest {

    private final UUID uploadId = UUID.randomUUID();
    private InMemoryWarehouse warehouse;
    private CircuitBreaker breaker;
    private ChunkWriter writer;

    @BeforeEach
    void setUp() {
        warehouse = new InMemoryWarehouse();
        breaker = new CircuitBreaker("database", 2, Duration.ofSeconds(30),
                new MutableClock(Instant.parse("2024-01-01T00:00:00Z")));
        ResourcePoolManager pool = new ResourcePoolManager(warehouse.dataSource(), breaker, new FailureClassifier());
        writer = new ChunkWriter(pool, new DeduplicationService(new ContentHasher(), warehouse), warehouse);
    }

    private ChunkWork chunk(String prefix, int count) {
        List<InvoiceLine> lines = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            lines.add(InvoiceLine.builder()
                    .rowNumber(i)
                    .invoiceNo("INV-" + prefix + "-" + i)
                    .invoiceDate(LocalDate.of(2024, 3, 15))
                    .storeName("Store")
                    .itemName("Item " + i)
                    .quantity(new BigDecimal("2"))
                    .rate(new BigDecimal("10.50"))
                    .amount(new BigDecimal("21.00"))
                    .rawFields(Map.of("InvoiceNo", "INV-" + prefix + "-" + i))
                    .build());
        }
        return new ChunkWork(uploadId, UUID.randomUUID(), 0, 1, count + 1, lines);
    }

    @Test
    @DisplayName("commits a clean chunk in one transaction")
    void cleanChunk() {
        ChunkResult result = writer.write(chunk("a", 10));

        assertThat(result.getInserted()).isEqualTo(10);
        assertThat(result.getDuplicates()).isZero();
        assertThat(result.getErrors()).isEmpty();
        assertThat(warehouse.lineCount()).isEqualTo(10);
        assertThat(warehouse.upsertCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("rows already written by an earlier chunk count as duplicates")
    void duplicatesAcrossChunks() {
        writer.write(chunk("a", 10));

        ChunkResult again = writer.write(chunk("a", 10));

        assertThat(again.getInserted()).isZero();
        assertThat(again.getDuplicates()).isEqualTo(10);
        assertThat(warehouse.lineCount()).isEqualTo(10);
    }

    @Test
    @DisplayName("a row rejected by the database fails alone and the rest commit")
    void fatalRowIsolated() {
        warehouse.poison("INV-a-4");

        ChunkResult result = writer.write(chunk("a", 10));

        assertThat(result.getInserted()).isEqualTo(9);
        assertThat(result.getFailed()).isEqualTo(1);
        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.rowNumber()).isEqualTo(4);
            assertThat(error.severity()).isEqualTo(ErrorSeverity.FATAL);
            assertThat(error.rawFields()).containsEntry("InvoiceNo", "INV-a-4");
        });
        assertThat(warehouse.lineCount()).isEqualTo(9);
        assertThat(warehouse.containsInvoice("INV-a-4")).isFalse();
        assertThat(warehouse.hashCount()).isEqualTo(9);
    }

    @Test
    @DisplayName("a transient failure rolls back and is surfaced for retry")
    void transientFailure() {
        warehouse.failNextUpserts(1, () -> new SQLTransientConnectionException("connection reset", "08006"));

        assertThatThrownBy(() -> writer.write(chunk("a", 5)))
                .isInstanceOf(TransientChunkException.class)
                .hasFieldOrPropertyWithValue("chunkIndex", 0);
        assertThat(warehouse.lineCount()).isZero();
        assertThat(warehouse.hashCount()).isZero();

        ChunkResult retried = writer.write(chunk("a", 5));
        assertThat(retried.getInserted()).isEqualTo(5);
    }

    @Test
    @DisplayName("an open circuit fails fast without opening a connection")
    void openCircuit() {
        warehouse.failAllUpserts(() -> new SQLTransientConnectionException("down", "08001"));
        assertThatThrownBy(() -> writer.write(chunk("a", 1))).isInstanceOf(TransientChunkException.class);
        assertThatThrownBy(() -> writer.write(chunk("b", 1))).isInstanceOf(TransientChunkException.class);
        int opened = warehouse.connectionsOpened();

        assertThatThrownBy(() -> writer.write(chunk("c", 1)))
                .isInstanceOf(TransientChunkException.class)
                .hasCauseInstanceOf(CircuitOpenException.class);
        assertThat(warehouse.connectionsOpened()).isEqualTo(opened);
    }
}
