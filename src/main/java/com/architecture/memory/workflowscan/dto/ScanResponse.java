package com.architecture.memory.workflowscan.dto;

import com.architecture.memory.workflowscan.model.ScanStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanResponse {
    private String scanId;
    private ScanStatus status;
    private String message;
}
