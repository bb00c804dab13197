package com.architecture.memory.workflowscan.repository;

import com.architecture.memory.workflowscan.model.ScanRecord;
import com.architecture.memory.workflowscan.model.ScanStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Scan history stored in MongoDB.
 */
@Repository
public interface ScanRecordRepository extends MongoRepository<ScanRecord, String> {

    /**
     * Newest scans first
     */
    Page<ScanRecord> findAllByOrderByCreatedAtDesc(Pageable pageable);

    long countByViewedFalse();

    /**
     * Scans that were still running when the service stopped
     */
    List<ScanRecord> findByStatusIn(Collection<ScanStatus> statuses);
}
