package io.crewcomposer.core.schedule;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.regex.Pattern;

public final class Timestamps {
    private static final Pattern DATE_ONLY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern SPACE_SEPARATED = Pattern.compile("^\\d{4}-\\d{2}-\\d{2} \\d");

    private Timestamps() {
    }

    /**
     * Parses an ISO-8601 instant, offset or zoned date-time, local date-time or bare date.
     * Values without an offset are interpreted in {@code zone}.
     *
     * @throws java.time.format.DateTimeParseException when the text is not ISO-8601
     */
    public static Instant parse(String text, ZoneId zone) {
        String value = text.trim();
        if (DATE_ONLY.matcher(value).matches()) {
            return LocalDate.parse(value).atStartOfDay(zone).toInstant();
        }
        if (SPACE_SEPARATED.matcher(value).find()) {
            value = value.replaceFirst(" ", "T");
        }
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value, ZonedDateTime::from, LocalDateTime::from);
        if (parsed instanceof ZonedDateTime zoned) {
            return zoned.toInstant();
        }
        return ((LocalDateTime) parsed).atZone(zone).toInstant();
    }
}
