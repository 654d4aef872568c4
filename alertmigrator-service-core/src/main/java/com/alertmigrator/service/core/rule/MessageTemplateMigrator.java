package com.alertmigrator.service.core.rule;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites legacy {@code ${name}} interpolation into the unified template language, where the values come from the
 * labels of every query merged together.
 */
public final class MessageTemplateMigrator {

    static final String MERGED_LABELS_PREFIX = "{{- $mergedLabels := mergeLabelValues $values -}}\n";

    private static final Pattern VARIABLE = Pattern.compile("\\$\\{([^}]+)}");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private MessageTemplateMigrator() {}

    public static String migrate(String message) {
        if (message == null || message.isEmpty()) {
            return message == null ? "" : message;
        }
        Matcher m = VARIABLE.matcher(message);
        if (!m.find()) {
            return message;
        }
        m.reset();
        StringBuilder out = new StringBuilder(MERGED_LABELS_PREFIX);
        while (m.find()) {
            m.appendReplacement(out, Matcher.quoteReplacement(reference(m.group(1))));
        }
        m.appendTail(out);
        return out.toString();
    }

    private static String reference(String name) {
        if (IDENTIFIER.matcher(name).matches()) {
            return "{{$mergedLabels." + name + "}}";
        }
        return "{{index $mergedLabels \"" + name.replace("\\", "\\\\").replace("\"", "\\\"") + "\"}}";
    }
}
