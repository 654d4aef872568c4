package com.alertmigrator.service.core.support;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses legacy duration strings such as "5m", "1h30m", "7d" as well as ISO-8601 "PT5M". A leading "now-" is
 * accepted so time range parameters like "now-15m" can be passed as is.
 */
public final class DurationParser {

    private static final Pattern PART = Pattern.compile("(\\d+)(ms|s|m|h|d|w|y)");

    private DurationParser() {}

    public static Duration parse(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Duration cannot be null or empty");
        }

        String trimmed = input.trim();
        if (trimmed.startsWith("P") || trimmed.startsWith("-P")) {
            try {
                return Duration.parse(trimmed);
            } catch (RuntimeException ex) {
                throw new IllegalArgumentException("Unsupported duration format: " + input, ex);
            }
        }

        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("now-")) {
            lower = lower.substring("now-".length());
        }
        if ("now".equals(lower) || "0".equals(lower)) {
            return Duration.ZERO;
        }

        Matcher m = PART.matcher(lower);
        Duration total = Duration.ZERO;
        int consumed = 0;
        while (m.find()) {
            if (m.start() != consumed) {
                throw new IllegalArgumentException("Unsupported duration format: " + input);
            }
            long value = Long.parseLong(m.group(1));
            total = total.plus(unit(m.group(2), value));
            consumed = m.end();
        }
        if (consumed == 0 || consumed != lower.length()) {
            throw new IllegalArgumentException("Unsupported duration format: " + input);
        }
        return total;
    }

    private static Duration unit(String unit, long value) {
        return switch (unit) {
            case "ms" -> Duration.ofMillis(value);
            case "s" -> Duration.ofSeconds(value);
            case "m" -> Duration.ofMinutes(value);
            case "h" -> Duration.ofHours(value);
            case "d" -> Duration.ofDays(value);
            case "w" -> Duration.ofDays(value * 7);
            case "y" -> Duration.ofDays(value * 365);
            default -> throw new IllegalArgumentException("Unsupported duration unit: " + unit);
        };
    }
}
