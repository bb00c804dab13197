package com.architecture.memory.workflowscan.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Position of a detected operation in a source file. Line numbers are 1-based.
 */
@Value
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CodeLocation {
    String filePath;
    int lineNumber;
    Integer column;
    Integer endLine;

    public static CodeLocation of(String filePath, int lineNumber) {
        return new CodeLocation(filePath, lineNumber, null, null);
    }

    @Override
    public String toString() {
        return filePath + ":" + lineNumber;
    }
}
