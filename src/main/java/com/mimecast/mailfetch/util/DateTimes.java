package com.mimecast.mailfetch.util;

import com.mimecast.mailfetch.exceptions.InvalidParameterException;
import org.apache.commons.lang3.StringUtils;

import java.time.DateTimeException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Mail date utilities.
 */
public class DateTimes {

    /**
     * RFC 3339 output format.
     */
    public static final DateTimeFormatter RFC3339 = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssxxx", Locale.ENGLISH);

    private static final Pattern COMMENT = Pattern.compile("\\([^)]*\\)");
    private static final Pattern WEEKDAY = Pattern.compile("^[A-Za-z]{3,9},\\s*");

    private static final List<DateTimeFormatter> FORMATS = List.of(
            formatter("d MMM yyyy H:mm[:ss] Z"),
            formatter("d MMM yyyy H:mm[:ss] z"),
            formatter("d MMM yy H:mm[:ss] Z")
    );

    /**
     * Protected constructor.
     */
    private DateTimes() {
        throw new IllegalStateException("Static class");
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }

    /**
     * Parses a message date into RFC 3339 in UTC.
     * <p>Parenthesised comments and the weekday are ignored.
     * <p>Dates that cannot be parsed are returned unchanged.
     *
     * @param dateHeader Date header value.
     * @return RFC 3339 date string or the input.
     * @throws InvalidParameterException Blank input.
     */
    public static String parseDateTime(String dateHeader) {
        if (StringUtils.isBlank(dateHeader)) {
            throw new InvalidParameterException("parseDateTime() expects parameter 1 to be a parsable string datetime");
        }

        String cleaned = COMMENT.matcher(dateHeader).replaceAll(" ");
        cleaned = WEEKDAY.matcher(cleaned.trim()).replaceFirst("");
        cleaned = cleaned.replaceAll("\\s+", " ").trim();

        for (DateTimeFormatter format : FORMATS) {
            try {
                ZonedDateTime parsed = ZonedDateTime.parse(cleaned, format);
                return parsed.withZoneSameInstant(ZoneOffset.UTC).format(RFC3339);
            } catch (DateTimeException e) {
                // Try next format.
            }
        }

        return dateHeader;
    }

    /**
     * Current time as RFC 3339 in UTC.
     *
     * @return Date string.
     */
    public static String now() {
        return OffsetDateTime.now(ZoneOffset.UTC).format(RFC3339);
    }
}
