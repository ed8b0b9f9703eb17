package com.proofly.backend.services.normalization;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Tries an ordered list of patterns; the first one that parses wins. Month-first is tried
 * before day-first, so {@code 03/04/2024} is March 4th.
 */
public final class DateParser {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            strict("uuuu-MM-dd"),
            strict("MM/dd/uuuu"),
            strict("dd/MM/uuuu"),
            strict("M/d/uuuu"),
            strict("uuuu/MM/dd"),
            strict("dd-MMM-uuuu"),
            strict("MMM d, uuuu"),
            strict("MMMM d, uuuu")
    );

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            strict("uuuu-MM-dd HH:mm:ss"),
            strict("MM/dd/uuuu HH:mm:ss"),
            strict("dd/MM/uuuu HH:mm:ss"),
            strict("uuuu-MM-dd'T'HH:mm:ss"),
            strict("uuuu-MM-dd HH:mm"),
            strict("MM/dd/uuuu HH:mm")
    );

    private DateParser() {}

    public static Optional<LocalDateTime> parse(String raw) {
        if (raw == null) return Optional.empty();
        String v = raw.trim();
        if (v.isEmpty()) return Optional.empty();

        for (DateTimeFormatter f : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(v, f).atStartOfDay());
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        for (DateTimeFormatter f : DATE_TIME_FORMATS) {
            try {
                return Optional.of(LocalDateTime.parse(v, f));
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        return Optional.empty();
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
    }
}
