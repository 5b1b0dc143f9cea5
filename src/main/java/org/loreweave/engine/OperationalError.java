package org.loreweave.engine;

import java.time.Instant;

/**
 * A recoverable failure of a template or system during a tick.
 *
 * @param timestamp when the error occurred
 * @param errorType category, e.g. "SYSTEM_FAILED" or "TEMPLATE_FAILED"
 * @param message human readable description
 * @param details tick and unit that failed
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
