package io.zipstream.time;

import java.time.Clock;
import java.time.Instant;

/**
 * Calendar date and time derived from seconds since 1970-01-01T00:00:00Z, and its packed
 * MS-DOS form as stored in ZIP headers.
 * <p>
 * The epoch-to-date mapping matches the timestamps written by earlier releases of the archive
 * writer. It is not a strict proleptic Gregorian conversion: some days near month ends map to the
 * neighbouring day (for example {@code 886273502} maps to 1998-02-01), but every result is a valid
 * calendar date with the day within its month.
 */
public record CalendarDateTime(int year, int month, int day, int hour, int minute, int second) {

    public static final int MAX_YEAR = 0xFFFF;

    private static final int DOS_EPOCH_YEAR = 1980;

    private static final long DAYS_TO_2000 = 10957;
    private static final long DAYS_FROM_1960_TO_1970 = 3653;

    private static final long[][] CYCLES_FROM_2000 = {
            {400 * 365 + 97, 400},
            {100 * 365 + 24, 100},
            {4 * 365 + 1, 4},
            {365, 1},
    };

    private static final long[][] CYCLES_FROM_1960 = {
            {4 * 365 + 1, 4},
            {365, 1},
    };

    private static final int[] FEBRUARY_28 = {31, 28, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};
    private static final int[] FEBRUARY_29 = {31, 29, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};

    public static CalendarDateTime now(Clock clock) {
        return of(clock.instant());
    }

    /**
     * Converts an instant, clamping anything before the epoch to the epoch itself.
     */
    public static CalendarDateTime of(Instant instant) {
        return fromEpochSeconds(Math.max(0L, instant.getEpochSecond()));
    }

    /**
     * @param epochSeconds whole seconds since the epoch, not negative
     * @throws IllegalArgumentException if the value is negative or lands beyond year {@value #MAX_YEAR}
     */
    public static CalendarDateTime fromEpochSeconds(long epochSeconds) {
        if (epochSeconds < 0) {
            throw new IllegalArgumentException("Epoch seconds must not be negative: " + epochSeconds);
        }
        int second = (int) (epochSeconds % 60);
        long rest = epochSeconds / 60;
        int minute = (int) (rest % 60);
        rest /= 60;
        int hour = (int) (rest % 24);
        long days = rest / 24;

        long year;
        long dayOfYear;
        if (days > DAYS_TO_2000) {
            year = 2000;
            dayOfYear = days - DAYS_TO_2000;
            for (long[] cycle : CYCLES_FROM_2000) {
                year += dayOfYear / cycle[0] * cycle[1];
                dayOfYear %= cycle[0];
            }
        } else {
            year = 1960;
            dayOfYear = days + DAYS_FROM_1960_TO_1970;
            for (long[] cycle : CYCLES_FROM_1960) {
                year += dayOfYear / cycle[0] * cycle[1];
                dayOfYear %= cycle[0];
            }
            dayOfYear += 1;
        }
        if (year > MAX_YEAR) {
            throw new IllegalArgumentException("Epoch seconds " + epochSeconds + " exceed year " + MAX_YEAR);
        }

        int[] monthLengths = isLeapYear((int) year) ? FEBRUARY_28 : FEBRUARY_29;
        int remaining = (int) dayOfYear;
        for (int i = 0; i < monthLengths.length; i++) {
            if (monthLengths[i] > remaining) {
                if (remaining == 0) {
                    return lastDayBefore((int) year, i + 1, hour, minute, second);
                }
                return new CalendarDateTime((int) year, i + 1, remaining, hour, minute, second);
            }
            remaining -= monthLengths[i];
        }
        // ran past the table, only reachable on the last day of some years before 2000
        return new CalendarDateTime((int) year, 12, 31, hour, minute, second);
    }

    // the legacy walk yields day 0 at month starts, which is read as the last day of the month before
    private static CalendarDateTime lastDayBefore(int year, int month, int hour, int minute, int second) {
        if (month == 1) {
            return new CalendarDateTime(year - 1, 12, 31, hour, minute, second);
        }
        int[] monthLengths = isLeapYear(year) ? FEBRUARY_29 : FEBRUARY_28;
        return new CalendarDateTime(year, month - 1, monthLengths[month - 2], hour, minute, second);
    }

    public static boolean isLeapYear(int year) {
        return year % 4 == 0 && (year % 100 != 0 || year % 400 == 0);
    }

    /**
     * Packs this date time into the 32-bit MS-DOS format used by ZIP headers. Seconds are stored
     * at two second resolution. Years before 1980 cannot be represented and yield {@code 0}.
     *
     * @return the packed value, to be read as unsigned
     */
    public int toDosTimestamp() {
        if (year < DOS_EPOCH_YEAR) {
            return 0;
        }
        return (year - DOS_EPOCH_YEAR) << 25
                | month << 21
                | day << 16
                | hour << 11
                | minute << 5
                | second >> 1;
    }
}
