package com.alertmigrator.service.core.rule;

import com.alertmigrator.service.core.telemetry.MigrationTelemetry;
import com.alertmigrator.service.core.telemetry.MigrationTelemetry.WarningKind;
import com.alertmigrator.unified.model.AlertQuery;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Fixes datasource query models that unified alerting cannot execute as they were saved for legacy alerting. */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryMigrator {

    static final String HIDE_FIELD = "hide";
    static final String GRAPHITE_TARGET = "target";
    static final String GRAPHITE_TARGET_FULL = "targetFull";

    private final MigrationTelemetry telemetry;

    public List<AlertQuery> migrate(List<AlertQuery> queries) {
        List<AlertQuery> result = new ArrayList<>(queries.size());
        for (AlertQuery query : queries) {
            if (query.isExpression()) {
                result.add(query);
                continue;
            }
            if (query.model() == null || !query.model().isObject()) {
                throw new IllegalArgumentException("query " + query.refId() + " model is not a JSON object");
            }
            ObjectNode model = ((ObjectNode) query.model()).deepCopy();
            model.remove(HIDE_FIELD);
            fixGraphiteReferencedSubQueries(model);
            fixPrometheusBothTypeQuery(model);
            result.add(query.withModel(model));
        }
        return result;
    }

    /** Unified alerting cannot resolve referenced sub-queries; {@code targetFull} holds the expanded target. */
    static void fixGraphiteReferencedSubQueries(ObjectNode model) {
        JsonNode full = model.remove(GRAPHITE_TARGET_FULL);
        if (full != null) {
            model.set(GRAPHITE_TARGET, full);
        }
    }

    /** A Prometheus query asking for both instant and range results becomes a range query. */
    void fixPrometheusBothTypeQuery(ObjectNode model) {
        Optional<Boolean> instant = booleanField(model, "instant");
        Optional<Boolean> range = booleanField(model, "range");
        if (instant.isEmpty() || range.isEmpty()) {
            return;
        }
        if (!instant.get() || !range.get()) {
            return;
        }
        String type = prometheusCandidateType(model);
        if (type == null) {
            log.info("Unable to convert query that resembles a Prometheus 'Both' query: datasource type is missing");
            return;
        }
        if (!"prometheus".equals(type)) {
            return;
        }
        log.warn("Prometheus 'Both' type queries are not supported in unified alerting, converting to range query");
        telemetry.recordWarning(WarningKind.PROMETHEUS_BOTH_QUERY);
        model.put("instant", false);
    }

    /** Absent fields read as false; a present non-boolean value yields empty so the query is left alone. */
    private Optional<Boolean> booleanField(ObjectNode model, String field) {
        JsonNode value = model.get(field);
        if (value == null) {
            return Optional.of(false);
        }
        if (!value.isBoolean()) {
            if ("prometheus".equals(prometheusCandidateType(model))) {
                log.info("Failed to parse {} field on Prometheus query: {}", field, value);
            }
            return Optional.empty();
        }
        return Optional.of(value.booleanValue());
    }

    private static String prometheusCandidateType(ObjectNode model) {
        JsonNode datasource = model.get("datasource");
        if (datasource == null || !datasource.isObject()) {
            return null;
        }
        String type = datasource.path("type").asText("");
        return type.isEmpty() ? null : type;
    }
}
