package com.alertmigrator.service.storage.impl;

import com.alertmigrator.service.core.store.AlertRuleStore;
import com.alertmigrator.unified.model.AlertQuery;
import com.alertmigrator.unified.model.AlertRule;
import com.alertmigrator.unified.model.ExecutionErrorState;
import com.alertmigrator.unified.model.NoDataState;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.util.List;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcAlertRuleStore implements AlertRuleStore {

    private static final TypeReference<List<AlertQuery>> QUERIES = new TypeReference<>() {};

    private static final String INSERT =
            """
            insert into alert_rule (org_id, uid, title, condition_ref, data, interval_seconds, version, namespace_uid,
                                    dashboard_uid, panel_id, rule_group, rule_group_idx, for_seconds, updated, labels,
                                    annotations, is_paused, no_data_state, exec_err_state)
            values (:org, :uid, :title, :cond, :data, :interval, :version, :ns, :dash, :panel, :rg, :rgIdx, :for,
                    :updated, :labels, :annotations, :paused, :noData, :execErr)
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;

    public JdbcAlertRuleStore(NamedParameterJdbcTemplate jdbc, ObjectMapper mapper) {
        this.jdbc = jdbc;
        this.json = new JsonColumns(mapper);
    }

    @Override
    public void insertAll(List<AlertRule> rules) {
        if (rules.isEmpty()) {
            return;
        }
        SqlParameterSource[] batch = rules.stream().map(this::params).toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(INSERT, batch);
    }

    @Override
    public List<AlertRule> findByOrg(long orgId) {
        return jdbc.query(
                "select * from alert_rule where org_id = :org order by id",
                new MapSqlParameterSource("org", orgId),
                (rs, i) -> map(rs));
    }

    @Override
    public int deleteByOrg(long orgId) {
        return jdbc.update("delete from alert_rule where org_id = :org", new MapSqlParameterSource("org", orgId));
    }

    private MapSqlParameterSource params(AlertRule rule) {
        return new MapSqlParameterSource()
                .addValue("org", rule.orgId())
                .addValue("uid", rule.uid())
                .addValue("title", rule.title())
                .addValue("cond", rule.condition())
                .addValue("data", json.write(rule.data()))
                .addValue("interval", rule.intervalSeconds())
                .addValue("version", rule.version())
                .addValue("ns", rule.namespaceUid())
                .addValue("dash", rule.dashboardUid())
                .addValue("panel", rule.panelId())
                .addValue("rg", rule.ruleGroup())
                .addValue("rgIdx", rule.ruleGroupIndex())
                .addValue("for", rule.forDuration().toSeconds())
                .addValue("updated", Timestamp.from(rule.updated()))
                .addValue("labels", json.write(rule.labels()))
                .addValue("annotations", json.write(rule.annotations()))
                .addValue("paused", rule.paused())
                .addValue("noData", rule.noDataState().value())
                .addValue("execErr", rule.execErrState().value());
    }

    private AlertRule map(ResultSet rs) throws SQLException {
        long panelId = rs.getLong("panel_id");
        Long panel = rs.wasNull() ? null : panelId;
        return new AlertRule(
                rs.getLong("org_id"),
                rs.getString("uid"),
                rs.getString("title"),
                rs.getString("condition_ref"),
                json.read(rs.getString("data"), QUERIES, List.of()),
                rs.getLong("interval_seconds"),
                rs.getLong("version"),
                rs.getString("namespace_uid"),
                rs.getString("dashboard_uid"),
                panel,
                rs.getString("rule_group"),
                rs.getInt("rule_group_idx"),
                Duration.ofSeconds(rs.getLong("for_seconds")),
                rs.getTimestamp("updated").toInstant(),
                json.readStringMap(rs.getString("labels")),
                json.readStringMap(rs.getString("annotations")),
                rs.getBoolean("is_paused"),
                NoDataState.fromValue(rs.getString("no_data_state")),
                ExecutionErrorState.fromValue(rs.getString("exec_err_state")));
    }
}
