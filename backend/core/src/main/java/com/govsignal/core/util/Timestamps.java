package com.govsignal.core.util;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

// Values without an offset are read as UTC and date-only values as midnight UTC.
public final class Timestamps {
    private static final long SECONDS_PER_DAY = 86_400L;

    private static final DateTimeFormatter SPACED_LOCAL = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT)
            .withChronology(IsoChronology.INSTANCE);

    private static final DateTimeFormatter SPACED_OFFSET = new DateTimeFormatterBuilder()
            .append(SPACED_LOCAL)
            .appendOffsetId()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT)
            .withChronology(IsoChronology.INSTANCE);

    private static final List<Function<String, Instant>> PARSERS = List.of(
            Instant::parse,
            value -> OffsetDateTime.parse(value).toInstant(),
            value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC),
            value -> OffsetDateTime.parse(value, SPACED_OFFSET).toInstant(),
            value -> LocalDateTime.parse(value, SPACED_LOCAL).toInstant(ZoneOffset.UTC),
            value -> LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private Timestamps() {
    }

    public static Optional<Instant> parseUtc(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        return PARSERS.stream()
                .map(parser -> safelyParse(parser, value))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .findFirst();
    }

    private static Optional<Instant> safelyParse(Function<String, Instant> parser, String value) {
        try {
            return Optional.of(parser.apply(value));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    public static long daysUntil(Instant now, Instant target) {
        return Math.floorDiv(Duration.between(now, target).getSeconds(), SECONDS_PER_DAY);
    }

    public static long daysSince(Instant now, Instant past) {
        return Math.floorDiv(Duration.between(past, now).getSeconds(), SECONDS_PER_DAY);
    }
}
