// file: src/main/java/io/branchtree/core/Timestamps.java
package io.branchtree.core;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Document and node timestamps: ISO-8601 with a numeric offset, second
 * precision, in the zone of the supplied clock (e.g. 2025-01-01T08:00:00+08:00).
 */
public final class Timestamps {
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssxxx");

    private Timestamps() {
        // utility
    }

    public static String now(Clock clock) {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS).format(FORMAT);
    }
}
