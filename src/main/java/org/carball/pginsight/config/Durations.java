package org.carball.pginsight.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses durations written either as ISO-8601 ({@code PT30S}) or in short form
 * ({@code 500ms}, {@code 30s}, {@code 5m}, {@code 2h}, {@code 7d}, {@code 1h30m}).
 */
public final class Durations {

    private static final Pattern SHORT_PART = Pattern.compile("(\\d+)(ms|s|m|h|d)");

    private Durations() {
    }

    public static Duration parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Duration not specified");
        }
        String value = text.trim().toLowerCase();
        if (value.startsWith("p")) {
            try {
                return Duration.parse(value.toUpperCase());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid duration: " + text, e);
            }
        }

        Matcher matcher = SHORT_PART.matcher(value);
        Duration total = Duration.ZERO;
        int end = 0;
        while (matcher.find()) {
            if (matcher.start() != end) {
                throw new IllegalArgumentException("Invalid duration: " + text);
            }
            long amount = Long.parseLong(matcher.group(1));
            total = total.plus(unit(amount, matcher.group(2)));
            end = matcher.end();
        }
        if (end == 0 || end != value.length()) {
            throw new IllegalArgumentException("Invalid duration: " + text + " (use e.g. 30s, 5m, 24h or PT30S)");
        }
        return total;
    }

    /**
     * Compact rendering for messages, e.g. {@code 24h}, {@code 1h30m}, {@code 45s}.
     */
    public static String format(Duration duration) {
        if (duration.isZero()) {
            return "0s";
        }
        StringBuilder sb = new StringBuilder();
        long days = duration.toDays();
        if (days > 0) {
            sb.append(days).append('d');
        }
        if (duration.toHoursPart() > 0) {
            sb.append(duration.toHoursPart()).append('h');
        }
        if (duration.toMinutesPart() > 0) {
            sb.append(duration.toMinutesPart()).append('m');
        }
        if (duration.toSecondsPart() > 0) {
            sb.append(duration.toSecondsPart()).append('s');
        }
        if (sb.length() == 0) {
            sb.append(duration.toMillis()).append("ms");
        }
        return sb.toString();
    }

    private static Duration unit(long amount, String unit) {
        return switch (unit) {
            case "ms" -> Duration.ofMillis(amount);
            case "s" -> Duration.ofSeconds(amount);
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            case "d" -> Duration.ofDays(amount);
            default -> throw new IllegalArgumentException("Unknown duration unit: " + unit);
        };
    }
}
