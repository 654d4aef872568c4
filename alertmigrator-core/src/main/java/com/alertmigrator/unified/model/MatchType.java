package com.alertmigrator.unified.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchType {
    EQUAL("="),
    NOT_EQUAL("!="),
    REGEXP("=~"),
    NOT_REGEXP("!~");

    private final String operator;

    MatchType(String operator) {
        this.operator = operator;
    }

    @JsonValue
    public String operator() {
        return operator;
    }
}
