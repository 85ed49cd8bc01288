package org.podtrace.series;

import org.podtrace.lang.Option;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

import static org.podtrace.lang.Option.none;
import static org.podtrace.lang.Option.some;

/**
 * Parsing of export timestamps.
 * <p>
 * Accepted forms:
 * <ul>
 *   <li>{@code 2026-01-20 14:23:05} and {@code 2026-01-20 14:23:05.250} (exporter default, UTC)</li>
 *   <li>ISO-8601 local date-times, offset date-times and instants</li>
 *   <li>epoch seconds, optionally fractional: {@code 1768919000.5}</li>
 * </ul>
 */
public final class Timestamps {
    private static final Pattern EPOCH_SECONDS = Pattern.compile("^-?\\d+(\\.\\d+)?$");
    private static final Pattern OFFSET_SUFFIX = Pattern.compile(".*(Z|[+-]\\d{2}:\\d{2})$");

    private Timestamps() {}

    public static Option<Instant> parse(String text) {
        if (text == null) {
            return none();
        }
        var value = text.trim();
        if (value.isEmpty()) {
            return none();
        }
        if (EPOCH_SECONDS.matcher(value)
                         .matches()) {
            return epochSeconds(value);
        }
        var iso = value.replace(' ', 'T');
        try{
            return some(OFFSET_SUFFIX.matcher(iso)
                                     .matches()
                        ? OffsetDateTime.parse(iso)
                                        .toInstant()
                        : LocalDateTime.parse(iso)
                                       .toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return none();
        }
    }

    private static Option<Instant> epochSeconds(String value) {
        var decimal = new BigDecimal(value);
        long seconds;
        try{
            seconds = decimal.setScale(0, RoundingMode.DOWN)
                             .longValueExact();
        } catch (ArithmeticException e) {
            return none();
        }
        if (seconds < Instant.MIN.getEpochSecond() || seconds >= Instant.MAX.getEpochSecond()) {
            return none();
        }
        var nanos = decimal.subtract(BigDecimal.valueOf(seconds))
                           .movePointRight(9)
                           .intValue();
        return some(Instant.ofEpochSecond(seconds, nanos));
    }
}
