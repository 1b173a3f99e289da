package com.telereplay.core.util;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Parses human-written durations such as {@code "1D 1m"}, {@code "2h3m6s"} or
 * {@code "120.05s"}.
 *
 * Numbers may be followed by a unit: D (days), h (hours), m (minutes),
 * s (seconds). A number without unit counts as seconds. Spaces are ignored.
 */
public final class DurationParser {

    private DurationParser() {
    }

    public static Duration parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Duration is null");
        }
        Duration total = Duration.ZERO;
        StringBuilder number = new StringBuilder();

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isDigit(c) || c == '.') {
                number.append(c);
            } else if (c == ' ') {
                continue;
            } else {
                total = total.plus(toDuration(number, secondsPerUnit(c)));
                number.setLength(0);
            }
        }
        return total.plus(toDuration(number, 1));
    }

    private static long secondsPerUnit(char unit) {
        return switch (unit) {
            case 'D' -> 86400;
            case 'h' -> 3600;
            case 'm' -> 60;
            case 's' -> 1;
            default -> throw new IllegalArgumentException("Unknown suffix: " + unit);
        };
    }

    private static Duration toDuration(CharSequence number, long secondsPerUnit) {
        if (number.length() == 0) {
            return Duration.ZERO;
        }
        try {
            BigDecimal seconds = new BigDecimal(number.toString()).multiply(BigDecimal.valueOf(secondsPerUnit));
            return Duration.ofNanos(seconds.movePointRight(9).longValueExact());
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("Invalid number: " + number, e);
        }
    }
}
