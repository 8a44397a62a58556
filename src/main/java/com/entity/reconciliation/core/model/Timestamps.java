package com.entity.reconciliation.core.model;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Timestamp conventions: RFC 3339 UTC strings for created/visited/updated and unix
 * seconds for TTL.
 */
public final class Timestamps {

    private static final DateTimeFormatter RFC3339 = DateTimeFormatter.ISO_INSTANT;

    private Timestamps() {
    }

    public static String now() {
        return RFC3339.format(Instant.now().truncatedTo(ChronoUnit.SECONDS));
    }

    /**
     * Unix seconds {@code hours} from now.
     */
    public static long future(int hours) {
        return Instant.now().plus(hours, ChronoUnit.HOURS).getEpochSecond();
    }
}
