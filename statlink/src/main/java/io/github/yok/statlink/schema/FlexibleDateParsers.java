package io.github.yok.statlink.schema;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.Year;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;

/**
 * Permissive date parsing for dataset values.
 *
 * <p>
 * Statistical exports carry periods in several shapes: a bare year ({@code 2019}), a month
 * ({@code 2019-03}), an ISO date, or a date-time. A bare year maps to January 1st and a month to
 * its first day, which is how yearly indicator columns become dates.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class FlexibleDateParsers {

    /**
     * Date-time parser accepting {@code yyyy-MM-dd HH:mm[:ss[.fraction]]} and the ISO {@code T}
     * separator.
     */
    static final DateTimeFormatter FLEXIBLE_LOCAL_DATE_TIME_PARSER =
            new DateTimeFormatterBuilder().append(DateTimeFormatter.ISO_LOCAL_DATE).optionalStart()
                    .appendLiteral('T').optionalEnd().optionalStart().appendLiteral(' ')
                    .optionalEnd().appendPattern("HH:mm").optionalStart().appendPattern(":ss")
                    .optionalEnd().optionalStart()
                    .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
                    .toFormatter();

    /**
     * Date-only formatters tried in order after the year and month shapes.
     * <ol>
     * <li>{@code yyyy-MM-dd} (ISO)</li>
     * <li>{@code yyyy/MM/dd}</li>
     * <li>{@code yyyyMMdd} (basic ISO)</li>
     * <li>{@code dd.MM.yyyy}</li>
     * </ol>
     */
    static final DateTimeFormatter[] DATE_ONLY_FORMATTERS = {DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd"), DateTimeFormatter.BASIC_ISO_DATE,
            DateTimeFormatter.ofPattern("dd.MM.yyyy")};

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private FlexibleDateParsers() {}

    /**
     * Converts a raw value into a {@link LocalDate}.
     *
     * @param raw raw value (string, {@link java.sql.Date}, {@link LocalDate} or date-time)
     * @return the date
     * @throws IllegalArgumentException if the value is not a recognizable date
     */
    public static LocalDate toLocalDate(Object raw) {
        if (raw instanceof LocalDate) {
            return (LocalDate) raw;
        }
        if (raw instanceof java.sql.Date) {
            return ((java.sql.Date) raw).toLocalDate();
        }
        if (raw instanceof LocalDateTime) {
            return ((LocalDateTime) raw).toLocalDate();
        }
        if (raw instanceof Timestamp) {
            return ((Timestamp) raw).toLocalDateTime().toLocalDate();
        }
        String text = raw.toString().trim();
        LocalDate date = parseDate(text);
        if (date != null) {
            return date;
        }
        try {
            return LocalDateTime.parse(text, FLEXIBLE_LOCAL_DATE_TIME_PARSER).toLocalDate();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Not a date: " + text, e);
        }
    }

    /**
     * Converts a raw value into a {@link LocalDateTime}.
     *
     * @param raw raw value (string, {@link Timestamp}, {@link LocalDateTime} or date)
     * @return the date-time
     * @throws IllegalArgumentException if the value is not a recognizable date-time
     */
    public static LocalDateTime toLocalDateTime(Object raw) {
        if (raw instanceof LocalDateTime) {
            return (LocalDateTime) raw;
        }
        if (raw instanceof Timestamp) {
            return ((Timestamp) raw).toLocalDateTime();
        }
        if (raw instanceof OffsetDateTime) {
            return ((OffsetDateTime) raw).toLocalDateTime();
        }
        if (raw instanceof LocalDate) {
            return ((LocalDate) raw).atStartOfDay();
        }
        if (raw instanceof java.sql.Date) {
            return ((java.sql.Date) raw).toLocalDate().atStartOfDay();
        }
        String text = raw.toString().trim();
        try {
            return LocalDateTime.parse(text, FLEXIBLE_LOCAL_DATE_TIME_PARSER);
        } catch (DateTimeParseException e) {
            LocalDate date = parseDate(text);
            if (date != null) {
                return date.atStartOfDay();
            }
            throw new IllegalArgumentException("Not a date-time: " + text, e);
        }
    }

    /**
     * Parses the date-only shapes.
     *
     * @param text trimmed text
     * @return parsed date, or {@code null} when no date-only shape matches
     */
    private static LocalDate parseDate(String text) {
        if (text.matches("\\d{4}")) {
            return Year.parse(text).atDay(1);
        }
        if (text.matches("\\d{4}-\\d{2}")) {
            return YearMonth.parse(text).atDay(1);
        }
        for (DateTimeFormatter formatter : DATE_ONLY_FORMATTERS) {
            try {
                return LocalDate.parse(text, formatter);
            } catch (DateTimeParseException e) {
                log.trace("Date [{}] does not match {}", text, formatter);
            }
        }
        return null;
    }
}
