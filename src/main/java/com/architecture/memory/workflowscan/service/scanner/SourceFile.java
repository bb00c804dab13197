package com.architecture.memory.workflowscan.service.scanner;

import lombok.Value;

import java.util.List;

/**
 * Text of one file split into lines. {@code path} is the path nodes are attributed to, which
 * for paired markup (Angular templates) can differ from the file the text was read from.
 */
@Value
public class SourceFile {

    private static final int SNIPPET_CONTEXT_LINES = 2;

    String path;
    String content;
    List<String> lines;

    public static SourceFile of(String path, String content) {
        return new SourceFile(path, content, List.of(content.split("\n", -1)));
    }

    public SourceFile attributedTo(String otherPath) {
        return new SourceFile(otherPath, content, lines);
    }

    /**
     * @param lineNumber 1-based
     */
    public String line(int lineNumber) {
        return lines.get(lineNumber - 1);
    }

    public int lineCount() {
        return lines.size();
    }

    /**
     * Lines {@code from..to} (1-based, inclusive, clamped to the file) joined with newlines.
     */
    public String range(int from, int to) {
        int start = Math.max(1, from);
        int end = Math.min(lines.size(), to);
        if (start > end) return "";
        return String.join("\n", lines.subList(start - 1, end));
    }

    public String snippet(int lineNumber) {
        return range(lineNumber - SNIPPET_CONTEXT_LINES, lineNumber + SNIPPET_CONTEXT_LINES);
    }
}
