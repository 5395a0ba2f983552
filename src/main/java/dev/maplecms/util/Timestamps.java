package dev.maplecms.util;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Current time at the precision of a {@code TIMESTAMP} column, so a value returned right
 * after a write equals the one read back later.
 */
public final class Timestamps {

    private Timestamps() {
    }

    public static LocalDateTime now() {
        return LocalDateTime.now().truncatedTo(ChronoUnit.MICROS);
    }
}
