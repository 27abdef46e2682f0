package com.bulk.ingest.repository;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.bulk.ingest.model.UploadChunk;

@Repository
public interface UploadChunkRepository extends JpaRepository<UploadChunk, UUID> {
}
