package com.bulk.ingest.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.bulk.common.model.ProgressEvent;
import com.bulk.common.model.UploadStatus;
import com.bulk.ingest.config.PipelineConfiguration;
import com.bulk.ingest.model.UploadJob;
import com.bulk.ingest.repository.UploadJobRepository;
import com.bulk.ingest.support.MutableClock;

class ProgressReporterTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private UploadJobRepository repository;
    private ThreadPoolTaskExecutor dispatcher;
    private ProgressReporter reporter;

    @BeforeEach
    void setUp() {
        repository = mock(UploadJobRepository.class);
        dispatcher = new PipelineConfiguration().progressDispatchExecutor();
        dispatcher.initialize();
        reporter = new ProgressReporter(repository, new MutableClock(NOW), dispatcher);
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    private static UploadJob job(UploadStatus status) {
        return UploadJob.builder()
                .id(UUID.randomUUID())
                .fileName("invoices.csv")
                .fileSize(100L)
                .declaredRowCount(100L)
                .status(status)
                .processedRows(status.isTerminal() ? 90L : 0L)
                .duplicateRows(0L)
                .failedRows(status.isTerminal() ? 10L : 0L)
                .cancelRequested(false)
                .ownerId("tester")
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    /** Collects events and counts down once the stream completes. */
    static class Recorder implements ProgressListener {

        final List<ProgressEvent> events = new CopyOnWriteArrayList<>();
        final CountDownLatch completed = new CountDownLatch(1);

        @Override
        public void onEvent(ProgressEvent event) {
            events.add(event);
        }

        @Override
        public void onComplete() {
            completed.countDown();
        }

        boolean awaitCompletion() throws InterruptedException {
            return completed.await(5, TimeUnit.SECONDS);
        }
    }

    @Nested
    @DisplayName("live job")
    class LiveJob {

        @Test
        @DisplayName("a subscriber sees the snapshot first, then deltas in order, then the terminal event")
        void orderedStream() throws Exception {
            UploadJob job = job(UploadStatus.PROCESSING);
            reporter.start(job);
            reporter.record(job.getId(), 10, 0, 0);

            Recorder recorder = new Recorder();
            reporter.subscribe(job.getId(), recorder);
            reporter.record(job.getId(), 5, 2, 1);
            reporter.record(job.getId(), 20, 0, 0);
            reporter.finish(job.getId(), UploadStatus.PARTIALLY_COMPLETED);

            assertThat(recorder.awaitCompletion()).isTrue();
            assertThat(recorder.events).extracting(ProgressEvent::getProcessedRows).containsExactly(10L, 15L, 35L, 35L);
            assertThat(recorder.events.get(1).getProcessedDelta()).isEqualTo(5);
            assertThat(recorder.events.get(1).getFailedRows()).isEqualTo(1);
            ProgressEvent last = recorder.events.get(recorder.events.size() - 1);
            assertThat(last.isTerminal()).isTrue();
            assertThat(last.getStatus()).isEqualTo(UploadStatus.PARTIALLY_COMPLETED);
        }

        @Test
        @DisplayName("snapshots reflect live counters until the job finishes")
        void snapshot() {
            UploadJob job = job(UploadStatus.PROCESSING);
            reporter.start(job);
            reporter.record(job.getId(), 7, 3, 1);

            assertThat(reporter.snapshot(job.getId())).get()
                    .satisfies(dto -> {
                        assertThat(dto.getProcessedRows()).isEqualTo(7);
                        assertThat(dto.getDuplicateRows()).isEqualTo(3);
                        assertThat(dto.getFailedRows()).isEqualTo(1);
                        assertThat(dto.getStatus()).isEqualTo(UploadStatus.PROCESSING);
                    });

            reporter.finish(job.getId(), UploadStatus.COMPLETED);
            assertThat(reporter.record(job.getId(), 1, 0, 0)).isEmpty();
        }

        @Test
        @DisplayName("a subscriber attached while pending keeps its subscription when processing starts")
        void subscribeWhilePending() throws Exception {
            UploadJob job = job(UploadStatus.PENDING);
            when(repository.findById(job.getId())).thenReturn(Optional.of(job));
            Recorder recorder = new Recorder();

            reporter.subscribe(job.getId(), recorder);
            job.setStatus(UploadStatus.PROCESSING);
            reporter.start(job);
            reporter.record(job.getId(), 4, 0, 0);
            reporter.finish(job.getId(), UploadStatus.COMPLETED);

            assertThat(recorder.awaitCompletion()).isTrue();
            assertThat(recorder.events).extracting(ProgressEvent::getStatus).containsExactly(
                    UploadStatus.PENDING, UploadStatus.PROCESSING, UploadStatus.PROCESSING, UploadStatus.COMPLETED);
        }

        @Test
        @DisplayName("a closed subscription receives nothing further")
        void unsubscribe() throws Exception {
            UploadJob job = job(UploadStatus.PROCESSING);
            reporter.start(job);
            Recorder recorder = new Recorder();

            Subscription subscription = reporter.subscribe(job.getId(), recorder);
            subscription.close();
            reporter.record(job.getId(), 1, 0, 0);
            reporter.finish(job.getId(), UploadStatus.COMPLETED);

            Recorder probe = new Recorder();
            when(repository.findById(job.getId())).thenReturn(Optional.of(job(UploadStatus.COMPLETED)));
            reporter.subscribe(job.getId(), probe);
            assertThat(probe.awaitCompletion()).isTrue();
            assertThat(recorder.events).hasSize(1);
            assertThat(recorder.completed.getCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("a failing listener is dropped without affecting the others")
        void failingListener() throws Exception {
            UploadJob job = job(UploadStatus.PROCESSING);
            reporter.start(job);
            reporter.subscribe(job.getId(), event -> {
                throw new IllegalStateException("client gone");
            });
            Recorder recorder = new Recorder();
            reporter.subscribe(job.getId(), recorder);

            reporter.record(job.getId(), 1, 0, 0);
            reporter.finish(job.getId(), UploadStatus.COMPLETED);

            assertThat(recorder.awaitCompletion()).isTrue();
            assertThat(recorder.events).hasSize(3);
        }

        @Test
        @DisplayName("cancel requests are visible only while the job is live")
        void cancel() {
            UploadJob job = job(UploadStatus.PROCESSING);
            reporter.requestCancel(job.getId());
            assertThat(reporter.isCancelRequested(job.getId())).isFalse();

            reporter.start(job);
            reporter.requestCancel(job.getId());
            assertThat(reporter.isCancelRequested(job.getId())).isTrue();
        }
    }

    @Nested
    @DisplayName("finished or unknown job")
    class NotLive {

        @Test
        @DisplayName("a terminal job yields its final snapshot and completes")
        void terminal() throws Exception {
            UploadJob job = job(UploadStatus.COMPLETED);
            when(repository.findById(job.getId())).thenReturn(Optional.of(job));
            Recorder recorder = new Recorder();

            reporter.subscribe(job.getId(), recorder);

            assertThat(recorder.awaitCompletion()).isTrue();
            assertThat(recorder.events).singleElement().satisfies(event -> {
                assertThat(event.isTerminal()).isTrue();
                assertThat(event.getProcessedRows()).isEqualTo(90);
                assertThat(event.getFailedRows()).isEqualTo(10);
            });
            assertThat(reporter.snapshot(job.getId())).get()
                    .extracting(dto -> dto.getStatus()).isEqualTo(UploadStatus.COMPLETED);
        }

        @Test
        @DisplayName("events and completion run on the progress dispatcher thread")
        void dispatcherThread() throws Exception {
            UploadJob job = job(UploadStatus.COMPLETED);
            when(repository.findById(job.getId())).thenReturn(Optional.of(job));
            List<String> threads = new CopyOnWriteArrayList<>();
            CountDownLatch completed = new CountDownLatch(1);

            reporter.subscribe(job.getId(), new ProgressListener() {
                @Override
                public void onEvent(ProgressEvent event) {
                    threads.add(Thread.currentThread().getName());
                }

                @Override
                public void onComplete() {
                    threads.add(Thread.currentThread().getName());
                    completed.countDown();
                }
            });

            assertThat(completed.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(threads).hasSize(2).allSatisfy(name -> assertThat(name).startsWith("progress-dispatcher-"));
        }

        @Test
        @DisplayName("an unknown upload is rejected")
        void unknown() {
            UUID id = UUID.randomUUID();
            when(repository.findById(id)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> reporter.subscribe(id, new Recorder()))
                    .isInstanceOf(UploadNotFoundException.class);
            assertThat(reporter.snapshot(id)).isEmpty();
        }
    }
}
