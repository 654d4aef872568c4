package com.alertmigrator.unified.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** State a unified rule takes when its queries return no data. */
public enum NoDataState {
    ALERTING("Alerting"),
    NO_DATA("NoData"),
    OK("OK");

    private final String value;

    NoDataState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static NoDataState fromValue(String value) {
        for (NoDataState state : values()) {
            if (state.value.equals(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown no-data state: " + value);
    }
}
