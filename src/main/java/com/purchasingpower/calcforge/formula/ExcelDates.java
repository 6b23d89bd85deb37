package com.purchasingpower.calcforge.formula;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Spreadsheet date serials.
 *
 * <p>A serial counts days from 1899-12-30. Dates on or after 1900-03-01 count one day
 * more, which reserves serial 61 for the 1900-02-29 that spreadsheet software
 * believes exists. Serials run from 0 to the serial of 9999-12-31; anything outside
 * that range is a {@code #NUM!} error, raised as a {@link DateTimeException}.
 */
public final class ExcelDates {

    static final LocalDate EPOCH = LocalDate.of(1899, 12, 30);
    static final LocalDate LEAP_BUG_CUTOFF = LocalDate.of(1900, 3, 1);
    private static final long PHANTOM_LEAP_DAY = 61;
    private static final int MAX_YEAR = 9999;
    static final long MAX_SERIAL = serial(LocalDate.of(MAX_YEAR, 12, 31));
    private static final long NANOS_PER_DAY = 86_400_000_000_000L;

    private ExcelDates() {
    }

    public static long serial(LocalDate date) {
        long days = ChronoUnit.DAYS.between(EPOCH, date);
        return date.isBefore(LEAP_BUG_CUTOFF) ? days : days + 1;
    }

    /**
     * DATE(year, month, day). Years below 1900 are offsets from 1900; months and days
     * outside their range roll over into the neighbouring year or month.
     */
    public static long serial(int year, int month, int day) {
        if (year < 0 || year > MAX_YEAR) {
            throw new DateTimeException("#NUM! year " + year + " is outside 0.." + MAX_YEAR);
        }
        int fullYear = year < 1900 ? year + 1900 : year;
        LocalDate date = LocalDate.of(fullYear, 1, 1)
                .plusMonths(month - 1L)
                .plusDays(day - 1L);
        long serial = serial(date);
        if (serial < 0 || serial > MAX_SERIAL) {
            throw new DateTimeException("#NUM! DATE(" + year + "," + month + "," + day + ") is outside the serial range");
        }
        return serial;
    }

    public static DateParts parts(double serial) {
        if (Double.isNaN(serial) || serial < 0 || serial >= MAX_SERIAL + 1) {
            throw new DateTimeException("#NUM! date serial " + serial + " is outside 0.." + MAX_SERIAL);
        }
        long whole = (long) Math.floor(serial);
        if (whole == PHANTOM_LEAP_DAY) {
            return new DateParts(1900, 2, 29);
        }
        LocalDate date = EPOCH.plusDays(whole > PHANTOM_LEAP_DAY ? whole - 1 : whole);
        return new DateParts(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    /**
     * Serial of a value used as a date: numbers are serials already, ISO text is parsed.
     */
    public static double toSerial(Object value) {
        if (value instanceof String text) {
            String trimmed = text.trim();
            if (trimmed.length() >= 10 && Character.isDigit(trimmed.charAt(0)) && trimmed.charAt(4) == '-') {
                try {
                    return serial(LocalDate.parse(trimmed.substring(0, 10)));
                } catch (DateTimeParseException e) {
                    return ValueCoercion.toNumber(value);
                }
            }
        }
        return ValueCoercion.toNumber(value);
    }

    public static long today(Clock clock) {
        return serial(LocalDate.now(clock));
    }

    public static double now(Clock clock) {
        LocalDateTime now = LocalDateTime.now(clock);
        double fraction = now.toLocalTime().toNanoOfDay() / (double) NANOS_PER_DAY;
        return serial(now.toLocalDate()) + fraction;
    }

    public record DateParts(int year, int month, int day) {
    }
}
