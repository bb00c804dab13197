package com.architecture.memory.workflowscan.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to scan a local repository. Unset options fall back to the service defaults and the
 * repository's own {@code .workflow-scanner.yml}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanRequest {

    @NotBlank(message = "Repository path is required")
    private String repoPath;

    @Builder.Default
    private String scanType = "full";

    @Builder.Default
    private String performedBy = "system";

    private List<String> fileExtensions;

    private Boolean detectDatabase;
    private Boolean detectApi;
    private Boolean detectFiles;
    private Boolean detectMessages;
    private Boolean detectTransforms;

    @Min(value = 1, message = "At least one worker thread is required")
    private Integer workerThreads;
}
