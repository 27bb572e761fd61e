package org.cortexview.observatory.api.resources;

import java.time.Instant;

/**
 * A transient error observed while reading an external source or serving an observer.
 *
 * @param timestamp When the error occurred.
 * @param errorType A category for the error (e.g., "SOURCE_UNAVAILABLE", "MALFORMED_SAMPLE").
 * @param message   A human-readable description of the error.
 * @param details   Optional additional context, such as the failing endpoint.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
