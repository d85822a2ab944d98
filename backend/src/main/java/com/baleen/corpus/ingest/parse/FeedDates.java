package com.baleen.corpus.ingest.parse;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient date parsing for feed timestamps. Everything is normalized to UTC; anything
 * unrecognised yields {@code null}.
 *
 * <p>RFC 822 day names are ignored, since feeds often get them wrong, and the RFC 822 zone
 * abbreviations are fixed offsets rather than region zones.
 */
public final class FeedDates {
    private static final Pattern LEADING_DAY_NAME =
        Pattern.compile("^(?:mon|tue|wed|thu|fri|sat|sun)[a-z]*\\.?,?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_ZONE_NAME = Pattern.compile("^(.*\\d)\\s+([A-Za-z]{1,4})$");
    private static final Map<String, String> RFC822_ZONES = Map.ofEntries(
        Map.entry("UT", "+0000"),
        Map.entry("UTC", "+0000"),
        Map.entry("GMT", "+0000"),
        Map.entry("Z", "+0000"),
        Map.entry("EST", "-0500"),
        Map.entry("EDT", "-0400"),
        Map.entry("CST", "-0600"),
        Map.entry("CDT", "-0500"),
        Map.entry("MST", "-0700"),
        Map.entry("MDT", "-0600"),
        Map.entry("PST", "-0800"),
        Map.entry("PDT", "-0700")
    );

    private static final List<DateTimeFormatter> OFFSET_FORMATS = List.of(
        rfc822("d MMM yyyy H:mm[:ss] [xxx][Z]"),
        rfc822("d MMM yy H:mm[:ss] [xxx][Z]"),
        new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .appendPattern("[XXX][XX]")
            .toFormatter(Locale.ENGLISH)
    );
    private static final List<DateTimeFormatter> ZONED_FORMATS = List.of(
        rfc822("d MMM yyyy H:mm[:ss] zzz"),
        DateTimeFormatter.ISO_ZONED_DATE_TIME
    );

    private FeedDates() {
    }

    public static OffsetDateTime parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = withNumericZone(LEADING_DAY_NAME.matcher(raw.trim().replaceAll("\\s+", " ")).replaceFirst(""));
        for (DateTimeFormatter formatter : OFFSET_FORMATS) {
            try {
                return OffsetDateTime.parse(value, formatter).withOffsetSameInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        for (DateTimeFormatter formatter : ZONED_FORMATS) {
            try {
                return ZonedDateTime.parse(value, formatter).toOffsetDateTime().withOffsetSameInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        try {
            return Instant.parse(value).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // next format
        }
        try {
            return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // next format
        }
        try {
            return LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay().atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private static String withNumericZone(String value) {
        Matcher matcher = TRAILING_ZONE_NAME.matcher(value);
        if (!matcher.matches()) {
            return value;
        }
        String offset = RFC822_ZONES.get(matcher.group(2).toUpperCase(Locale.ROOT));
        if (offset == null) {
            return value;
        }
        return matcher.group(1).trim() + " " + offset;
    }

    private static DateTimeFormatter rfc822(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH);
    }
}
