package com.alertmigrator.unified.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/** One entry of a unified rule's data pipeline: a datasource query or an expression. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AlertQuery(
        String refId, String queryType, RelativeTimeRange relativeTimeRange, String datasourceUid, JsonNode model) {

    /** Pseudo datasource UID used by server-side expressions. */
    public static final String EXPRESSION_DATASOURCE_UID = "__expr__";

    @JsonIgnore
    public boolean isExpression() {
        return EXPRESSION_DATASOURCE_UID.equals(datasourceUid);
    }

    public AlertQuery withModel(JsonNode newModel) {
        return new AlertQuery(refId, queryType, relativeTimeRange, datasourceUid, newModel);
    }
}
