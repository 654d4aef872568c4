package com.alertmigrator.service.core.rule;

import com.alertmigrator.dashboard.model.Datasource;
import com.alertmigrator.legacy.model.DashboardAlertSettings;
import com.alertmigrator.legacy.model.DashboardAlertSettings.Condition;
import com.alertmigrator.legacy.model.DashboardAlertSettings.ConditionQuery;
import com.alertmigrator.legacy.model.DashboardAlertSettings.TypedParams;
import com.alertmigrator.service.core.store.DatasourceCache;
import com.alertmigrator.service.core.support.DurationParser;
import com.alertmigrator.unified.model.AlertQuery;
import com.alertmigrator.unified.model.RelativeTimeRange;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns legacy classic conditions into datasource queries followed by one {@code classic_conditions} expression.
 *
 * <p>Conditions that reference the same query over the same time range share one unified query. A query referenced
 * with several time ranges is split into one query per range, each under a new refId.
 */
@Component
@RequiredArgsConstructor
public class ConditionTranslator {

    static final String CLASSIC_CONDITIONS = "classic_conditions";
    static final int DEFAULT_MAX_DATA_POINTS = 43200;
    static final int DEFAULT_INTERVAL_MS = 1000;

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private final DatasourceCache datasourceCache;

    public MigratedCondition translate(long orgId, DashboardAlertSettings settings) {
        List<Condition> conditions = settings.conditions();
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("alert has no conditions");
        }

        Map<String, List<Integer>> byRefId = new TreeMap<>();
        for (int i = 0; i < conditions.size(); i++) {
            ConditionQuery query = conditions.get(i).query();
            int params = query == null ? 0 : query.params().size();
            if (params != 3) {
                throw new IllegalArgumentException(String.format(
                        "unexpected number of query parameters in cond %d, want 3 got %d", i + 1, params));
            }
            byRefId.computeIfAbsent(query.params().get(0), k -> new ArrayList<>())
                    .add(i);
        }

        // refIds used over a single range are kept as is and reserved before any new letter is handed out
        Set<String> used = new HashSet<>();
        Map<String, Map<TimeRange, List<Integer>>> rangesByRefId = new LinkedHashMap<>();
        for (Map.Entry<String, List<Integer>> entry : byRefId.entrySet()) {
            Map<TimeRange, List<Integer>> ranges = new TreeMap<>(TimeRange.ORDER);
            for (int idx : entry.getValue()) {
                ranges.computeIfAbsent(TimeRange.of(conditions.get(idx)), k -> new ArrayList<>())
                        .add(idx);
            }
            rangesByRefId.put(entry.getKey(), ranges);
            if (ranges.size() == 1) {
                used.add(entry.getKey());
            }
        }

        Map<Integer, String> newRefIdByCondition = new HashMap<>();
        Map<String, Integer> firstConditionByRefId = new TreeMap<>();
        for (Map.Entry<String, Map<TimeRange, List<Integer>>> entry : rangesByRefId.entrySet()) {
            Map<TimeRange, List<Integer>> ranges = entry.getValue();
            for (List<Integer> idxes : ranges.values()) {
                String refId = ranges.size() == 1 ? entry.getKey() : nextRefId(used);
                firstConditionByRefId.put(refId, idxes.get(0));
                idxes.forEach(idx -> newRefIdByCondition.put(idx, refId));
            }
        }

        List<AlertQuery> data = new ArrayList<>();
        firstConditionByRefId.forEach(
                (refId, idx) -> data.add(datasourceQuery(orgId, refId, conditions.get(idx).query())));

        String conditionRefId = nextRefId(used);
        data.add(classicConditions(conditionRefId, conditions, newRefIdByCondition));
        return new MigratedCondition(conditionRefId, data);
    }

    private AlertQuery datasourceQuery(long orgId, String refId, ConditionQuery query) {
        ObjectNode model;
        if (query.model() == null || query.model().isNull()) {
            model = JSON.objectNode();
        } else if (query.model().isObject()) {
            model = ((ObjectNode) query.model()).deepCopy();
        } else {
            throw new IllegalArgumentException("query " + refId + " model is not a JSON object");
        }

        Datasource datasource = resolveDatasource(orgId, query)
                .orElseThrow(() -> new IllegalArgumentException(
                        "failed to get datasource for query " + refId + " (datasourceId=" + query.datasourceId() + ")"));

        String queryType = model.path("queryType").isTextual()
                ? model.get("queryType").asText()
                : "";
        model.put("refId", refId);
        ObjectNode ds = JSON.objectNode();
        ds.put("uid", datasource.uid());
        ds.put("type", datasource.type());
        model.set("datasource", ds);
        if (!model.has("maxDataPoints")) {
            model.put("maxDataPoints", DEFAULT_MAX_DATA_POINTS);
        }
        if (!model.has("intervalMs")) {
            model.put("intervalMs", DEFAULT_INTERVAL_MS);
        }

        TimeRange range = TimeRange.of(query);
        return new AlertQuery(refId, queryType, range.toRelative(), datasource.uid(), model);
    }

    private Optional<Datasource> resolveDatasource(long orgId, ConditionQuery query) {
        if (query.datasourceId() > 0) {
            Optional<Datasource> byId = datasourceCache.getById(orgId, query.datasourceId());
            if (byId.isPresent()) {
                return byId;
            }
        }
        JsonNode ref = query.model() == null ? null : query.model().get("datasource");
        if (ref == null) {
            return Optional.empty();
        }
        if (ref.isObject() && ref.path("uid").isTextual()) {
            return datasourceCache.getByUid(orgId, ref.get("uid").asText());
        }
        if (ref.isTextual()) {
            return datasourceCache.getByName(orgId, ref.asText());
        }
        return Optional.empty();
    }

    private static AlertQuery classicConditions(
            String refId, List<Condition> conditions, Map<Integer, String> newRefIdByCondition) {
        ArrayNode translated = JSON.arrayNode();
        for (int i = 0; i < conditions.size(); i++) {
            Condition cond = conditions.get(i);
            ObjectNode c = translated.addObject();

            ObjectNode evaluator = c.putObject("evaluator");
            evaluator.put("type", typeOf(cond.evaluator()));
            JsonNode params = cond.evaluator() == null ? null : cond.evaluator().params();
            evaluator.set("params", params == null || params.isNull() ? JSON.arrayNode() : params.deepCopy());

            c.putObject("operator").put("type", typeOf(cond.operator()));
            c.putObject("query").putArray("params").add(newRefIdByCondition.get(i));
            c.putObject("reducer").put("type", typeOf(cond.reducer()));
        }

        ObjectNode model = JSON.objectNode();
        model.put("type", CLASSIC_CONDITIONS);
        model.put("refId", refId);
        model.set("conditions", translated);
        return new AlertQuery(
                refId, "", new RelativeTimeRange(0, 0), AlertQuery.EXPRESSION_DATASOURCE_UID, model);
    }

    private static String typeOf(TypedParams params) {
        return params == null || params.type() == null ? "" : params.type();
    }

    static String nextRefId(Set<String> used) {
        for (char c = 'A'; c <= 'Z'; c++) {
            String letter = String.valueOf(c);
            if (used.add(letter)) {
                return letter;
            }
        }
        throw new IllegalStateException("ran out of letters when creating expression");
    }

    /** Raw {@code [from, to]} query parameters, e.g. {@code ["5m", "now"]}. */
    record TimeRange(String from, String to) {
        static final Comparator<TimeRange> ORDER =
                Comparator.comparing(TimeRange::from).thenComparing(TimeRange::to);

        static TimeRange of(Condition condition) {
            return of(condition.query());
        }

        static TimeRange of(ConditionQuery query) {
            return new TimeRange(query.params().get(1), query.params().get(2));
        }

        RelativeTimeRange toRelative() {
            Duration fromDuration = DurationParser.parse(from);
            Duration toDuration = DurationParser.parse(to);
            return RelativeTimeRange.of(fromDuration, toDuration);
        }
    }
}
