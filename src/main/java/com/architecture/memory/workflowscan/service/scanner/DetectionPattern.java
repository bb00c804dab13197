package com.architecture.memory.workflowscan.service.scanner;

import lombok.Value;

import java.util.regex.Pattern;

/**
 * One regex in a scanner's pattern table. {@code label} carries the pattern-specific extraction
 * hint (HTTP method, client library, trigger type, messaging platform).
 */
@Value
public class DetectionPattern {
    Pattern regex;
    String label;

    public static DetectionPattern of(String regex) {
        return new DetectionPattern(Pattern.compile(regex), null);
    }

    public static DetectionPattern of(String regex, String label) {
        return new DetectionPattern(Pattern.compile(regex), label);
    }

    public static DetectionPattern ignoreCase(String regex) {
        return new DetectionPattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), null);
    }

    public static DetectionPattern ignoreCase(String regex, String label) {
        return new DetectionPattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), label);
    }
}
