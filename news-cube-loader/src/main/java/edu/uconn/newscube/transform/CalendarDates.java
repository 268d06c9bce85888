package edu.uconn.newscube.transform;

import edu.uconn.newscube.entity.DimTime;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.time.temporal.IsoFields;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Date parsing and YYYYMMDD date keys.
 */
@Slf4j
public final class CalendarDates {

    public static final int SENTINEL_DATE_KEY = 19000101;

    public static final LocalDate SENTINEL_DATE = LocalDate.of(1900, 1, 1);

    static final int MIN_YEAR = 1;
    static final int MAX_YEAR = 9999;

    private static final List<DateTimeFormatter> FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        DateTimeFormatter.ISO_OFFSET_DATE_TIME,
        DateTimeFormatter.ISO_ZONED_DATE_TIME,
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("yyyy/MM/dd", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("M/d/yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("M/d/yyyy H:mm", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("d MMM yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("d MMMM yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH),
        DateTimeFormatter.RFC_1123_DATE_TIME
    );

    private CalendarDates() {
    }

    /**
     * Parses the first format that accepts the whole text.
     *
     * @return the calendar day, empty for null, blank or unparseable input
     *     and for years that do not fit a YYYYMMDD key
     */
    public static Optional<LocalDate> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.strip();
        for (DateTimeFormatter format : FORMATS) {
            LocalDate date;
            try {
                date = LocalDate.from(format.parse(trimmed));
            } catch (DateTimeException e) {
                log.trace("Date '{}' does not match {}", trimmed, format);
                continue;
            }
            if (date.getYear() < MIN_YEAR || date.getYear() > MAX_YEAR) {
                log.debug("Date '{}' has year {} outside {}..{}", trimmed, date.getYear(), MIN_YEAR, MAX_YEAR);
                return Optional.empty();
            }
            return Optional.of(date);
        }
        return Optional.empty();
    }

    /**
     * @throws IllegalArgumentException for years outside 1..9999
     */
    public static int dateKey(LocalDate date) {
        if (date.getYear() < MIN_YEAR || date.getYear() > MAX_YEAR) {
            throw new IllegalArgumentException("Year " + date.getYear() + " does not fit a YYYYMMDD date key");
        }
        return date.getYear() * 10000 + date.getMonthValue() * 100 + date.getDayOfMonth();
    }

    /**
     * Date key of the text, or {@link #SENTINEL_DATE_KEY} when it cannot be parsed.
     */
    public static int dateKeyOf(String text) {
        return parse(text).map(CalendarDates::dateKey).orElse(SENTINEL_DATE_KEY);
    }

    public static LocalDate fromDateKey(int dateKey) {
        return LocalDate.of(dateKey / 10000, dateKey / 100 % 100, dateKey % 100);
    }

    public static DimTime toDimTime(LocalDate date) {
        return DimTime.builder()
            .dateKey(dateKey(date))
            .year(date.getYear())
            .quarter("Q" + ((date.getMonthValue() - 1) / 3 + 1))
            .month(date.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH))
            .monthNumber(date.getMonthValue())
            .day(date.getDayOfMonth())
            .dayOfWeek(date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH))
            .weekOfYear(date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR))
            .dateString(date.format(DateTimeFormatter.ISO_LOCAL_DATE))
            .build();
    }
}
