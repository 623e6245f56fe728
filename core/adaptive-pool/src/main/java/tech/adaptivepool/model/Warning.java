package tech.adaptivepool.model;

import java.time.Instant;

/**
 * Operator-facing notice raised by a pool, e.g. a unit restart or a fatal halt.
 *
 * @param id           unique warning id (UUID)
 * @param category     e.g. {@code UNIT_RESTART}, {@code POOL_FATAL}, {@code POOL_LIMIT}
 * @param severity     {@code CRITICAL}, {@code ERROR}, {@code WARNING} or {@code INFO}
 * @param message      what happened
 * @param timestamp    when the warning was raised
 * @param source       component that raised it, e.g. {@code AdaptivePool:thumbnails}
 * @param acknowledged whether an operator has seen it
 */
public record Warning(
    String id,
    String category,
    String severity,
    String message,
    Instant timestamp,
    String source,
    boolean acknowledged
) {

    public Warning acknowledge() {
        return new Warning(id, category, severity, message, timestamp, source, true);
    }
}
