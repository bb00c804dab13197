package com.architecture.memory.workflowscan.dto;

import com.architecture.memory.workflowscan.model.ScanRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanListResponse {
    private long total;
    private int page;
    private int size;
    private List<ScanRecord> scans;
}
