package com.alertmigrator.service.core.support;

import java.time.Duration;

/** Renders durations the way alertmanager configuration files spell them ("52w", "1h30m", "90d"). */
public final class PrometheusDurations {

    private static final long SECOND = 1000L;
    private static final long MINUTE = 60 * SECOND;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;
    private static final long WEEK = 7 * DAY;
    private static final long YEAR = 365 * DAY;

    private PrometheusDurations() {}

    public static String format(Duration duration) {
        long ms = duration.toMillis();
        if (ms == 0) {
            return "0s";
        }
        StringBuilder out = new StringBuilder();
        // years and weeks only when exact: "90d" reads better than "12w6d"
        ms = append(out, ms, YEAR, "y", true);
        ms = append(out, ms, WEEK, "w", true);
        ms = append(out, ms, DAY, "d", false);
        ms = append(out, ms, HOUR, "h", false);
        ms = append(out, ms, MINUTE, "m", false);
        ms = append(out, ms, SECOND, "s", false);
        append(out, ms, 1L, "ms", false);
        return out.toString();
    }

    private static long append(StringBuilder out, long ms, long unit, String suffix, boolean exact) {
        if (exact && ms % unit != 0) {
            return ms;
        }
        long value = ms / unit;
        if (value > 0) {
            out.append(value).append(suffix);
            return ms - value * unit;
        }
        return ms;
    }
}
