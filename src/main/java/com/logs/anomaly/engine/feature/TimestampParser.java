package com.logs.anomaly.engine.feature;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/**
 * Parses ISO-8601-like timestamps into a wall-clock {@link LocalDateTime}.
 *
 * Accepted forms:
 *   2024-01-15T10:30:00            local date-time, fractional seconds allowed
 *   2024-01-15 10:30:00            space instead of 'T'
 *   2024-01-15T10:30:00Z / +02:00  offset date-time, kept in its own offset
 *   2024-01-15T10:30:00+01:00[Europe/Paris]
 *   2024-01-15                     date only, midnight
 */
public final class TimestampParser {

    private static final List<Function<String, LocalDateTime>> PARSERS = List.of(
            s -> LocalDateTime.parse(s, DateTimeFormatter.ISO_LOCAL_DATE_TIME),
            s -> OffsetDateTime.parse(s, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toLocalDateTime(),
            s -> ZonedDateTime.parse(s, DateTimeFormatter.ISO_ZONED_DATE_TIME).toLocalDateTime(),
            s -> LocalDate.parse(s, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay()
    );

    private TimestampParser() {}

    /**
     * @throws DateTimeParseException if none of the accepted forms matches
     */
    public static LocalDateTime parse(String raw) {
        String text = raw.trim();
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }

        DateTimeParseException last = null;
        for (Function<String, LocalDateTime> parser : PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw last;
    }

    /** Monday = 0 ... Sunday = 6. */
    public static int dayOfWeek(LocalDateTime dateTime) {
        return dateTime.getDayOfWeek().getValue() - 1;
    }
}
