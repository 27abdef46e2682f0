package com.bulk.ingest.repository;

import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.bulk.ingest.model.ProcessingError;

/**
 * Error catalog for uploads. Rows are only ever appended.
 */
@Repository
public interface ProcessingErrorRepository extends JpaRepository<ProcessingError, Long> {

    Page<ProcessingError> findByUploadIdOrderByRowNumberAscIdAsc(UUID uploadId, Pageable pageable);
}
