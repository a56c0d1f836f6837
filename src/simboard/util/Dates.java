package simboard.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lenient date parsing for the assorted timestamp formats found in case metadata.
 */
public class Dates {
    private static final Logger log = LoggerFactory.getLogger(Dates.class);

    private static final Pattern SPACE_BEFORE_TIME = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) (\\d)");
    private static final Pattern LEADING_WEEKDAY = Pattern.compile("^[A-Za-z]{3}\\s+(?=[A-Za-z]{3}\\s)");

    static final DateTimeFormatter ISO_FLEXIBLE = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffset("+HH:MM", "Z")
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HHMM", "Z")
            .optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    /**
     * ctime style dates as written by the E3SM timing files, with the weekday already removed.
     */
    static final DateTimeFormatter CTIME = DateTimeFormatter.ofPattern("MMM d HH:mm:ss yyyy", Locale.ENGLISH);

    private Dates() {}

    /**
     * Parses a date or date-time, assuming UTC when no offset is given.
     *
     * @return the parsed value or null when the text is blank or unparseable
     */
    public static OffsetDateTime parseDateTime(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.strip();
        try {
            TemporalAccessor parsed = ISO_FLEXIBLE.parseBest(SPACE_BEFORE_TIME.matcher(value).replaceFirst("$1T$2"),
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            return toOffsetDateTime(parsed);
        } catch (DateTimeParseException e) {
            // fall through to the ctime format
        }
        LocalDateTime ctime = parseCtime(value);
        if (ctime != null) {
            return ctime.atOffset(ZoneOffset.UTC);
        }
        log.warn("Could not parse date '{}'", text);
        return null;
    }

    /**
     * Parses dates like {@code Tue Jan 10 12:34:56 2023}. The weekday is not checked against the date.
     *
     * @return the parsed value or null if the text is not in that format
     */
    public static LocalDateTime parseCtime(String text) {
        if (text == null) {
            return null;
        }
        String value = LEADING_WEEKDAY.matcher(text.strip().replaceAll("\\s+", " ")).replaceFirst("");
        try {
            return LocalDateTime.parse(value, CTIME);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static OffsetDateTime toOffsetDateTime(TemporalAccessor parsed) {
        if (parsed instanceof OffsetDateTime) {
            return (OffsetDateTime) parsed;
        } else if (parsed instanceof LocalDateTime) {
            return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
        } else {
            return ((LocalDate) parsed).atStartOfDay().atOffset(ZoneOffset.UTC);
        }
    }
}
