package com.flamingo.ai.linkextractor.domain.repository;

import com.flamingo.ai.linkextractor.domain.entity.ProcessingLogEntry;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for per-file processing log entries. */
@Repository
public interface ProcessingLogRepository extends JpaRepository<ProcessingLogEntry, UUID> {

  Optional<ProcessingLogEntry> findBySourceFile(String sourceFile);
}
