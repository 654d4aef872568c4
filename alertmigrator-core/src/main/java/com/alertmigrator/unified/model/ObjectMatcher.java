package com.alertmigrator.unified.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.regex.Pattern;

/** Label matcher serialized as a {@code [name, operator, value]} triple. */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"name", "type", "value"})
public record ObjectMatcher(String name, MatchType type, String value) {

    public boolean matches(String labelValue) {
        String actual = labelValue == null ? "" : labelValue;
        return switch (type) {
            case EQUAL -> actual.equals(value);
            case NOT_EQUAL -> !actual.equals(value);
            case REGEXP -> anchored(value).matcher(actual).matches();
            case NOT_REGEXP -> !anchored(value).matcher(actual).matches();
        };
    }

    private static Pattern anchored(String regex) {
        return Pattern.compile("^(?:" + regex + ")$", Pattern.DOTALL);
    }
}
