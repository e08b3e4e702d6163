package com.labware.echo.codec;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Locale;

/**
 * Survey timestamps such as {@code 2023-04-12 15:02:33.417}.
 *
 * Decoding also accepts the ISO form with a {@code T} separator and a trailing
 * zone offset ({@code Z} or {@code +HH:MM}). Instrument timestamps are local wall
 * clock time, so an offset is accepted but not kept: {@code 15:02:33+02:00}
 * decodes to 15:02:33.
 *
 * Encoding always uses a space and writes the fraction with 0, 3, 6 or 9 digits
 * depending on the precision the value carries, so vendor millisecond timestamps
 * round-trip unchanged. Other fraction widths are normalized ({@code .41} is
 * written as {@code .410}).
 */
public class TimestampCodec implements ScalarCodec<LocalDateTime> {

    private static final DateTimeFormatter PARSER = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd")
            .optionalStart().appendLiteral(' ').optionalEnd()
            .optionalStart().appendLiteral('T').optionalEnd()
            .appendPattern("HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HH:MM", "Z")
            .optionalEnd()
            .toFormatter();

    private static final DateTimeFormatter SECONDS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Override
    public LocalDateTime decode(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("empty timestamp");
        }
        try {
            return LocalDateTime.parse(raw.trim(), PARSER);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("unparseable timestamp", e);
        }
    }

    @Override
    public String encode(LocalDateTime value) {
        String seconds = SECONDS.format(value);
        int nanos = value.getNano();
        if (nanos == 0) {
            return seconds;
        }
        if (nanos % 1_000_000 == 0) {
            return seconds + String.format(Locale.ROOT, ".%03d", nanos / 1_000_000);
        }
        if (nanos % 1_000 == 0) {
            return seconds + String.format(Locale.ROOT, ".%06d", nanos / 1_000);
        }
        return seconds + String.format(Locale.ROOT, ".%09d", nanos);
    }

    @Override
    public ScalarType type() {
        return ScalarType.TIMESTAMP;
    }
}
