package com.architecture.memory.workflowscan.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Entity-to-table mapping discovered by the schema pre-pass.
 */
@Value
@Builder
public class TableSchema {
    String entityName;
    String tableName;
    String filePath;
    int lineNumber;
    String dbsetName;
    SchemaSource source;

    @Singular
    List<String> properties;

    @Singular("meta")
    Map<String, Object> metadata;
}
