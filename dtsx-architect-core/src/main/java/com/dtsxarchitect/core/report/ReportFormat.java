package com.dtsxarchitect.core.report;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Output formats of the package report.
 */
public enum ReportFormat {
    TEXT("text", "txt", "text/plain"),
    MARKDOWN("markdown", "md", "text/markdown"),
    JSON("json", "json", "application/json");

    private final String id;
    private final String fileExtension;
    private final String contentType;

    ReportFormat(String id, String fileExtension, String contentType) {
        this.id = id;
        this.fileExtension = fileExtension;
        this.contentType = contentType;
    }

    public String id() {
        return id;
    }

    /**
     * File extension without the leading dot.
     */
    public String fileExtension() {
        return fileExtension;
    }

    public String contentType() {
        return contentType;
    }

    /**
     * Looks a format up by id or file extension, ignoring case and surrounding blanks,
     * so {@code md}, {@code Markdown} and {@code txt} are accepted.
     *
     * @param value user input, may be null
     * @return matching format, or empty
     */
    public static Optional<ReportFormat> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String wanted = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(format -> format.id.equals(wanted) || format.fileExtension.equals(wanted))
            .findFirst();
    }

    /**
     * Parses a format, failing on unknown input.
     *
     * @param value user input
     * @return matching format
     * @throws IllegalArgumentException if no format matches
     */
    public static ReportFormat parse(String value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException(
            "Unknown report format: " + value + " (expected text, markdown or json)"));
    }
}
