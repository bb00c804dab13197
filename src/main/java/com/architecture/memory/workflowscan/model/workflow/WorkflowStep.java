package com.architecture.memory.workflowscan.model.workflow;

import com.architecture.memory.workflowscan.model.WorkflowNode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WorkflowStep {
    int stepNumber;
    String title;
    String description;
    String technicalDetails;
    String icon;

    @JsonIgnore
    WorkflowNode node;

    public String getNodeId() {
        return node != null ? node.getId() : null;
    }
}
