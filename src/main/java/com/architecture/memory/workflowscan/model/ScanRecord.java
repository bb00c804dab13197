package com.architecture.memory.workflowscan.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * History entry for one scan. The document id is the scan id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "scan_history")
public class ScanRecord {

    @Id
    private String scanId;

    private String repositoryPath;

    private String repositoryName;

    @Builder.Default
    private String scanType = "full";

    @Builder.Default
    private String performedBy = "system";

    @Indexed
    private LocalDateTime createdAt;

    private LocalDateTime completedAt;

    @Builder.Default
    private ScanStatus status = ScanStatus.QUEUED;

    @Indexed
    @Builder.Default
    private boolean viewed = false;

    private int filesScanned;

    private int nodesFound;

    private int edgesFound;

    private int workflowsFound;

    private Integer totalFiles;

    private double scanDuration;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    private String resultFile;
}
