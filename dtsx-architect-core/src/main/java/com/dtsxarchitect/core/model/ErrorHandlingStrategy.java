package com.dtsxarchitect.core.model;

import java.util.List;

/**
 * Event handlers and logging configuration of a package.
 *
 * @param eventHandlers package-level event handlers
 * @param failPackageOnFailure whether a failing executable fails the package
 * @param maxErrorCount errors tolerated before failing
 * @param loggingMode logging mode, {@code null} when absent
 * @param loggedEvents names of logged events
 */
public record ErrorHandlingStrategy(
    List<EventHandler> eventHandlers,
    boolean failPackageOnFailure,
    int maxErrorCount,
    String loggingMode,
    List<String> loggedEvents
) {
    /**
     * Compact constructor with validation.
     */
    public ErrorHandlingStrategy {
        eventHandlers = eventHandlers == null ? List.of() : List.copyOf(eventHandlers);
        loggedEvents = loggedEvents == null ? List.of() : List.copyOf(loggedEvents);
    }

    public static ErrorHandlingStrategy empty() {
        return new ErrorHandlingStrategy(List.of(), true, 1, null, List.of());
    }
}
