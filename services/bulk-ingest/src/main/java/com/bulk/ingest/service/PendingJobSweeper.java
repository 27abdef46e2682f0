package com.bulk.ingest.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.bulk.common.model.UploadStatus;
import com.bulk.ingest.broker.BrokerManager;
import com.bulk.ingest.broker.BrokerUnavailableException;
import com.bulk.ingest.broker.JobMessage;
import com.bulk.ingest.config.IngestProperties;
import com.bulk.ingest.model.UploadJob;
import com.bulk.ingest.repository.UploadJobRepository;
import com.bulk.ingest.resilience.CircuitOpenException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Re-queues jobs whose queue message appears lost: pending jobs untouched for
 * {@code requeue-after}, and processing jobs whose worker went silent for {@code stale-job-timeout}.
 * Extra messages are harmless because claiming is conditional.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PendingJobSweeper {

    private static final int BATCH_SIZE = 100;

    private final UploadJobRepository jobRepository;
    private final BrokerManager brokerManager;
    private final IngestProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${bulk.ingest.sweeper.interval:PT1M}",
            initialDelayString = "${bulk.ingest.sweeper.interval:PT1M}")
    public void sweep() {
        if (!properties.getSweeper().isEnabled() || !brokerManager.isAvailable()) {
            return;
        }
        Instant now = clock.instant();
        List<UploadJob> pending = jobRepository.findByStatusUpdatedBefore(UploadStatus.PENDING,
                now.minus(properties.getSweeper().getRequeueAfter()), PageRequest.of(0, BATCH_SIZE));
        List<UploadJob> stale = jobRepository.findByStatusUpdatedBefore(UploadStatus.PROCESSING,
                now.minus(properties.getStaleJobTimeout()), PageRequest.of(0, BATCH_SIZE));

        int requeued = 0;
        try {
            for (UploadJob job : pending) {
                brokerManager.enqueue(JobMessage.first(job.getId(), now));
                jobRepository.touch(job.getId(), now, UploadStatus.PENDING);
                requeued++;
            }
            for (UploadJob job : stale) {
                brokerManager.enqueue(JobMessage.first(job.getId(), now));
                requeued++;
            }
        } catch (CircuitOpenException | BrokerUnavailableException e) {
            log.warn("Sweep stopped after {} re-queued jobs, broker unavailable: {}", requeued, e.getMessage());
            return;
        }
        if (requeued > 0) {
            log.info("Re-queued {} pending and {} stale uploads", pending.size(), stale.size());
        }
    }
}
