package com.dtsxarchitect.core.graph;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Helpers for reference strings such as {@code Package\Load Customers}.
 *
 * <p>Segments are separated by a backslash; a forward slash is accepted as well.
 */
public final class ReferencePaths {

    private static final Pattern SEPARATOR = Pattern.compile("[\\\\/]");

    private ReferencePaths() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Splits a reference into its path segments.
     *
     * @param reference reference string, may be null
     * @return segments, empty for a null or empty reference
     */
    public static List<String> segments(String reference) {
        if (reference == null || reference.isEmpty()) {
            return List.of();
        }
        return List.of(SEPARATOR.split(reference, -1));
    }

    /**
     * Returns the final segment, which by convention names the referenced entity.
     *
     * @param reference reference string, may be null
     * @return last segment, or the empty string
     */
    public static String lastSegment(String reference) {
        List<String> segments = segments(reference);
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    /**
     * Returns the part of the last segment before its first dot, e.g. {@code Lookup} for
     * {@code Package\Flow\Lookup.Outputs[Match]}.
     *
     * @param reference reference string, may be null
     * @return component part of the last segment
     */
    public static String componentPart(String reference) {
        String last = lastSegment(reference);
        int dot = last.indexOf('.');
        return dot >= 0 ? last.substring(0, dot) : last;
    }
}
