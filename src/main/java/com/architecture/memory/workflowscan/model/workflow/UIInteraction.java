package com.architecture.memory.workflowscan.model.workflow;

import com.architecture.memory.workflowscan.model.WorkflowNode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * A user-initiated event (click, submit, page load) that starts a workflow.
 */
@Value
@Builder
public class UIInteraction {
    String id;
    String name;
    String component;
    InteractionType interactionType;
    String location;
    String description;

    @JsonIgnore
    WorkflowNode node;
}
