package com.gridintel.generation.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * The run's logical time: wall clock floored to a 10-minute boundary, used as
 * the persistence key regardless of scheduler jitter.
 */
public final class EffectiveTimestamps {

    public static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final int STEP_MINUTES = 10;

    private EffectiveTimestamps() {
    }

    public static ZonedDateTime floorToTenMinutes(ZonedDateTime time) {
        int minute = (time.getMinute() / STEP_MINUTES) * STEP_MINUTES;
        return time.truncatedTo(ChronoUnit.HOURS).withMinute(minute);
    }

    /**
     * Wall-clock time in the feed's zone, whatever zone the clock itself carries.
     */
    public static LocalDateTime localNow(Clock clock, ZoneId zone) {
        return LocalDateTime.now(clock.withZone(zone));
    }

    public static String format(LocalDateTime timestamp) {
        return timestamp == null ? "" : FORMAT.format(timestamp);
    }

    /**
     * Accepts the persisted format and ISO local date-times (with or without seconds).
     */
    public static Optional<LocalDateTime> parse(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String trimmed = text.trim();
        try {
            return Optional.of(LocalDateTime.parse(trimmed, FORMAT));
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(LocalDateTime.parse(trimmed.replace(' ', 'T')));
            } catch (DateTimeParseException ignored) {
                return Optional.empty();
            }
        }
    }
}
