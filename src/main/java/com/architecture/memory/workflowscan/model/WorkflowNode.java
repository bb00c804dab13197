package com.architecture.memory.workflowscan.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A single operation detected by a scanner while reading one file.
 *
 * <p>Nodes are immutable and compared structurally; the id follows the
 * {@code "<file>:<category>:<line>"} convention. Type-specific attributes
 * (table, endpoint, queue, ...) are only populated for the matching {@link WorkflowType}.
 */
@Value
@Builder(toBuilder = true)
public class WorkflowNode {

    public static final String META_UI_TRIGGER = "is_ui_trigger";

    String id;
    WorkflowType type;
    String name;
    String description;
    CodeLocation location;

    @Singular("meta")
    Map<String, Object> metadata;

    String codeSnippet;

    // Database operations
    String tableName;
    String query;

    // API calls
    String endpoint;
    String method;

    // File operations (target file, not the scanned file)
    String filePath;

    // Messaging
    String queueName;
    String topic;

    @JsonIgnore
    public boolean isUiTrigger() {
        return Boolean.TRUE.equals(metadata.get(META_UI_TRIGGER));
    }

    @JsonIgnore
    public String getSourceFile() {
        return location != null ? location.getFilePath() : null;
    }

    @JsonIgnore
    public int getLine() {
        return location != null ? location.getLineNumber() : 0;
    }
}
