package org.neuralchilli.qrun.util;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human-readable durations such as {@code 500ms}, {@code 30s} or {@code 1h30m}.
 * <p>
 * Units: {@code ms}, {@code s}, {@code m}, {@code h}, {@code d}. A bare number is
 * seconds. {@code 0} and blank values mean "no duration" and yield {@code null}.
 * Durations must fit in a {@code long} of milliseconds.
 */
public final class DurationParser {

    private static final Pattern GROUP = Pattern.compile("(\\d+)\\s*(ms|s|m|h|d)");
    private static final Pattern BARE_NUMBER = Pattern.compile("\\d+");

    private DurationParser() {
    }

    /**
     * @return the parsed duration, or {@code null} for blank or zero input
     * @throws IllegalArgumentException if the value is not a valid duration
     */
    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }

        String text = value.trim().toLowerCase(Locale.ROOT);

        try {
            if (BARE_NUMBER.matcher(text).matches()) {
                return checked(Duration.ofSeconds(parseAmount(text, value)), value);
            }

            Matcher matcher = GROUP.matcher(text);
            Duration total = Duration.ZERO;
            int position = 0;

            while (matcher.find()) {
                if (matcher.start() != position && !text.substring(position, matcher.start()).isBlank()) {
                    throw invalid(value);
                }
                long amount = parseAmount(matcher.group(1), value);
                total = total.plus(toDuration(amount, matcher.group(2)));
                position = matcher.end();
            }

            if (position == 0 || !text.substring(position).isBlank()) {
                throw invalid(value);
            }

            return checked(total, value);
        } catch (ArithmeticException e) {
            throw invalid(value);
        }
    }

    /**
     * Parse a YAML scalar: integers are seconds, strings go through {@link #parse(String)}.
     */
    public static Duration parse(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            long seconds = number.longValue();
            if (seconds < 0) {
                throw invalid(value.toString());
            }
            return checked(Duration.ofSeconds(seconds), value.toString());
        }
        return parse(value.toString());
    }

    private static Duration toDuration(long amount, String unit) {
        return switch (unit) {
            case "ms" -> Duration.ofMillis(amount);
            case "s" -> Duration.ofSeconds(amount);
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            case "d" -> Duration.ofDays(amount);
            default -> throw new IllegalArgumentException("Unknown duration unit: " + unit);
        };
    }

    private static long parseAmount(String digits, String original) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw invalid(original);
        }
    }

    /**
     * Zero becomes {@code null}; anything too large for millisecond timers is rejected.
     */
    private static Duration checked(Duration duration, String original) {
        try {
            duration.toMillis();
        } catch (ArithmeticException e) {
            throw invalid(original);
        }
        return duration.isZero() ? null : duration;
    }

    private static IllegalArgumentException invalid(String value) {
        return new IllegalArgumentException("Invalid duration: '" + value + "'");
    }
}
