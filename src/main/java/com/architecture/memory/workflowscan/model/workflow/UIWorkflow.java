package com.architecture.memory.workflowscan.model.workflow;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Ordered chain of operations reachable from one UI trigger, with a plain-language summary.
 */
@Value
@Builder
public class UIWorkflow {
    String id;
    String name;
    UIInteraction trigger;
    List<WorkflowStep> steps;
    String summary;
    String outcome;

    /**
     * A workflow with no steps carries no story; callers usually drop it.
     */
    @JsonIgnore
    public boolean isTrivial() {
        return steps == null || steps.isEmpty();
    }

    public String getStory() {
        return toStory();
    }

    /**
     * Markdown narrative of the workflow.
     */
    public String toStory() {
        StringBuilder story = new StringBuilder();
        story.append("# ").append(name).append("\n\n");
        story.append("**What happens:** ").append(summary).append("\n\n");
        story.append("**User action:** ").append(trigger != null ? trigger.getDescription() : "").append("\n\n");
        story.append("## Workflow Steps:\n");
        if (steps != null) {
            for (WorkflowStep step : steps) {
                story.append('\n')
                        .append(step.getIcon()).append(" **Step ").append(step.getStepNumber())
                        .append(": ").append(step.getTitle()).append("**\n")
                        .append(step.getDescription()).append('\n')
                        .append("_Technical: ").append(step.getTechnicalDetails()).append("_\n");
            }
        }
        story.append("\n**Result:** ").append(outcome).append('\n');
        return story.toString();
    }
}
