package com.architecture.memory.workflowscan.service;

import com.architecture.memory.workflowscan.dto.ScanListResponse;
import com.architecture.memory.workflowscan.exception.ScanNotFoundException;
import com.architecture.memory.workflowscan.model.ScanRecord;
import com.architecture.memory.workflowscan.model.ScanStatus;
import com.architecture.memory.workflowscan.repository.ScanRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Consumer;

@Service
@RequiredArgsConstructor
@Slf4j
public class ScanHistoryService {

    private static final int MAX_PAGE_SIZE = 100;
    static final String INTERRUPTED = "Scan interrupted by service restart";
    private static final List<ScanStatus> IN_PROGRESS =
            List.of(ScanStatus.QUEUED, ScanStatus.DISCOVERING, ScanStatus.SCANNING, ScanStatus.ANALYZING);

    private final ScanRecordRepository scanRecordRepository;

    public ScanRecord create(String scanId, String repositoryPath, String scanType, String performedBy) {
        ScanRecord record = ScanRecord.builder()
                .scanId(scanId)
                .repositoryPath(repositoryPath)
                .repositoryName(repositoryName(repositoryPath))
                .scanType(scanType != null ? scanType : "full")
                .performedBy(performedBy != null ? performedBy : "system")
                .createdAt(LocalDateTime.now())
                .status(ScanStatus.QUEUED)
                .build();
        ScanRecord saved = scanRecordRepository.save(record);
        log.info("[{}] Scan recorded for {}", scanId, repositoryPath);
        return saved;
    }

    /**
     * Apply {@code changes} to the stored record and save it.
     *
     * @throws ScanNotFoundException if no record exists for {@code scanId}
     */
    public ScanRecord update(String scanId, Consumer<ScanRecord> changes) {
        ScanRecord record = get(scanId);
        changes.accept(record);
        return scanRecordRepository.save(record);
    }

    public ScanListResponse list(int page, int size) {
        if (page < 0) {
            throw new IllegalArgumentException("Page must not be negative");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("Page size must be between 1 and " + MAX_PAGE_SIZE);
        }
        Page<ScanRecord> scans = scanRecordRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(page, size));
        return ScanListResponse.builder()
                .total(scans.getTotalElements())
                .page(page)
                .size(size)
                .scans(scans.getContent())
                .build();
    }

    public ScanRecord get(String scanId) {
        return scanRecordRepository.findById(scanId)
                .orElseThrow(() -> new ScanNotFoundException(scanId));
    }

    public ScanRecord markViewed(String scanId) {
        return update(scanId, record -> record.setViewed(true));
    }

    public long unviewedCount() {
        return scanRecordRepository.countByViewedFalse();
    }

    /**
     * Fail every scan still recorded as in progress. Only valid before any scan is started.
     *
     * @return number of records updated
     */
    public int markInterrupted() {
        List<ScanRecord> stale = scanRecordRepository.findByStatusIn(IN_PROGRESS);
        for (ScanRecord record : stale) {
            record.setStatus(ScanStatus.ERROR);
            record.setCompletedAt(LocalDateTime.now());
            record.getErrors().add(INTERRUPTED);
            scanRecordRepository.save(record);
        }
        return stale.size();
    }

    static String repositoryName(String repositoryPath) {
        if (repositoryPath == null || repositoryPath.isBlank()) {
            return "unknown";
        }
        Path fileName = Path.of(repositoryPath).getFileName();
        return fileName != null ? fileName.toString() : repositoryPath;
    }
}
