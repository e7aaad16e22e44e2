package com.marketdw.etl.calendar;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Conversions between {@link LocalDate} and the yyyyMMdd integers used as processing units.
 */
public final class TradeDates {
    private static final DateTimeFormatter BASIC = DateTimeFormatter.BASIC_ISO_DATE;

    private TradeDates() {
    }

    public static int toUnit(LocalDate date) {
        return date.getYear() * 10000 + date.getMonthValue() * 100 + date.getDayOfMonth();
    }

    public static LocalDate toDate(int unit) {
        return LocalDate.of(unit / 10000, (unit / 100) % 100, unit % 100);
    }

    public static int parse(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("trade date must not be empty");
        }
        String value = raw.trim().replace("-", "");
        try {
            return toUnit(LocalDate.parse(value, BASIC));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid trade date (expected yyyyMMdd): " + raw, e);
        }
    }

    public static String format(int unit) {
        return Integer.toString(unit);
    }

    /**
     * Calendar-valid predecessor; {@code 20240101} becomes {@code 20231231}, not {@code 20240100}.
     */
    public static int previousDay(int unit) {
        return toUnit(toDate(unit).minusDays(1));
    }

    public static int nextDay(int unit) {
        return toUnit(toDate(unit).plusDays(1));
    }
}
