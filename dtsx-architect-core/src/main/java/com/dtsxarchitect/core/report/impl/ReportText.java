package com.dtsxarchitect.core.report.impl;

import com.dtsxarchitect.core.graph.ReferencePaths;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Formatting helpers shared by the report generators.
 */
final class ReportText {

    static final String NOT_AVAILABLE = "N/A";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private ReportText() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    static String orNa(String value) {
        return value == null || value.isEmpty() ? NOT_AVAILABLE : value;
    }

    static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }

    static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Left-aligns text in a column; longer text is kept whole.
     */
    static String pad(String value, int width) {
        return String.format("%-" + width + "s", value == null ? "" : value);
    }

    static String timestamp(Clock clock) {
        return LocalDateTime.now(clock).format(TIMESTAMP);
    }

    /**
     * Display names of stage references, e.g. {@code Package\Load} becomes {@code Load}.
     */
    static String stageNames(List<String> references) {
        return references.stream().map(ReferencePaths::lastSegment).collect(Collectors.joining(", "));
    }

    static String yesNo(boolean flag) {
        return flag ? "Yes" : "No";
    }
}
