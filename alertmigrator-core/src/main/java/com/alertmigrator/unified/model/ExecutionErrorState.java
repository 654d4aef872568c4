package com.alertmigrator.unified.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** State a unified rule takes when its evaluation fails. */
public enum ExecutionErrorState {
    ALERTING("Alerting"),
    ERROR("Error"),
    OK("OK");

    private final String value;

    ExecutionErrorState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static ExecutionErrorState fromValue(String value) {
        for (ExecutionErrorState state : values()) {
            if (state.value.equals(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown execution error state: " + value);
    }
}
