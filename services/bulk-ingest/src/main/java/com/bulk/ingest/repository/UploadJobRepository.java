package com.bulk.ingest.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.bulk.common.model.UploadStatus;
import com.bulk.ingest.model.UploadJob;

@Repository
public interface UploadJobRepository extends JpaRepository<UploadJob, UUID> {

    @Query("SELECT j FROM UploadJob j WHERE j.status = :status AND j.updatedAt < :updatedBefore ORDER BY j.updatedAt ASC")
    List<UploadJob> findByStatusUpdatedBefore(@Param("status") UploadStatus status,
            @Param("updatedBefore") Instant updatedBefore, Pageable pageable);

    @Modifying
    @Transactional
    @Query("UPDATE UploadJob j SET j.updatedAt = :now WHERE j.id = :id AND j.status = :status")
    int touch(@Param("id") UUID id, @Param("now") Instant now, @Param("status") UploadStatus status);

    /**
     * Claims a job for processing. Succeeds for pending jobs, and for processing jobs whose
     * owner stopped reporting progress before {@code staleBefore}.
     *
     * @return 1 if this caller now owns the job, 0 otherwise
     */
    @Modifying
    @Transactional
    @Query("UPDATE UploadJob j SET j.status = :processing, j.startedAt = :now, j.updatedAt = :now, "
            + "j.processedRows = 0, j.duplicateRows = 0, j.failedRows = 0 "
            + "WHERE j.id = :id AND (j.status = :pending OR (j.status = :processing AND j.updatedAt < :staleBefore))")
    int claim(@Param("id") UUID id, @Param("now") Instant now, @Param("staleBefore") Instant staleBefore,
            @Param("pending") UploadStatus pending, @Param("processing") UploadStatus processing);

    @Modifying
    @Transactional
    @Query("UPDATE UploadJob j SET j.processedRows = :processed, j.duplicateRows = :duplicates, "
            + "j.failedRows = :failed, j.updatedAt = :now WHERE j.id = :id AND j.status = :processing")
    int updateProgress(@Param("id") UUID id, @Param("processed") long processed,
            @Param("duplicates") long duplicates, @Param("failed") long failed, @Param("now") Instant now,
            @Param("processing") UploadStatus processing);

    @Modifying
    @Transactional
    @Query("UPDATE UploadJob j SET j.status = :cancelled, j.cancelRequested = true, j.completedAt = :now, "
            + "j.updatedAt = :now WHERE j.id = :id AND j.status = :pending")
    int cancelPending(@Param("id") UUID id, @Param("now") Instant now,
            @Param("pending") UploadStatus pending, @Param("cancelled") UploadStatus cancelled);

    @Query("SELECT j.cancelRequested FROM UploadJob j WHERE j.id = :id")
    Optional<Boolean> findCancelRequestedById(@Param("id") UUID id);

    @Modifying
    @Transactional
    @Query("UPDATE UploadJob j SET j.cancelRequested = true, j.updatedAt = :now WHERE j.id = :id")
    int markCancelRequested(@Param("id") UUID id, @Param("now") Instant now);
}
