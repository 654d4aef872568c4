package com.alertmigrator.legacy.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed form of a legacy alert's {@code settings} JSON.
 *
 * <p>{@code alertRuleTags} is kept raw: only a JSON object is turned into labels, arrays and scalars are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DashboardAlertSettings(
        List<Condition> conditions,
        String noDataState,
        String executionErrorState,
        List<NotificationRef> notifications,
        JsonNode alertRuleTags) {

    public DashboardAlertSettings {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        notifications = notifications == null ? List.of() : List.copyOf(notifications);
        noDataState = noDataState == null ? "" : noDataState;
        executionErrorState = executionErrorState == null ? "" : executionErrorState;
    }

    public Map<String, String> tags() {
        Map<String, String> tags = new LinkedHashMap<>();
        if (alertRuleTags == null || !alertRuleTags.isObject()) {
            return tags;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = alertRuleTags.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            tags.put(field.getKey(), field.getValue().asText());
        }
        return tags;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Condition(
            String type, ConditionQuery query, TypedParams reducer, TypedParams evaluator, TypedParams operator) {}

    /** {@code params} is {@code [refId, from, to]}, e.g. {@code ["A", "5m", "now"]}. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConditionQuery(List<String> params, long datasourceId, JsonNode model) {
        public ConditionQuery {
            params = params == null ? List.of() : List.copyOf(params);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TypedParams(String type, JsonNode params) {}

    /** A channel reference; either {@code id} or {@code uid} is set. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NotificationRef(Long id, String uid) {}
}
