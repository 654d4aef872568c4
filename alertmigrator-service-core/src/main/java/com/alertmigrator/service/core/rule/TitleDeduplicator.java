package com.alertmigrator.service.core.rule;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

/** Keeps rule titles unique within one folder, within a maximum length. */
public class TitleDeduplicator {

    private final Set<String> seen = new HashSet<>();
    private final int maxLength;
    private final boolean caseInsensitive;

    public TitleDeduplicator(int maxLength, boolean caseInsensitive) {
        this.maxLength = maxLength;
        this.caseInsensitive = caseInsensitive;
    }

    /**
     * Truncates {@code title} and, when the result is taken, appends {@code "_" + suffix}, cutting the title further so
     * the whole still fits. {@code moreSuffixes} is asked in the rare case the suffixed title is taken too. The
     * returned title is recorded.
     */
    public String deduplicate(String title, String suffix, Supplier<String> moreSuffixes) {
        String candidate = truncate(title, maxLength);
        String next = suffix;
        while (contains(candidate)) {
            String tail = "_" + (next != null ? next : moreSuffixes.get());
            next = null;
            candidate = truncate(title, maxLength - tail.length()) + tail;
        }
        add(candidate);
        return candidate;
    }

    public boolean contains(String title) {
        return seen.contains(key(title));
    }

    public void add(String title) {
        seen.add(key(title));
    }

    static String truncate(String value, int max) {
        return value.length() > max ? value.substring(0, Math.max(max, 0)) : value;
    }

    private String key(String title) {
        return caseInsensitive ? title.toLowerCase(Locale.ROOT) : title;
    }
}
