package com.alertmigrator.service.storage.impl;

import com.alertmigrator.legacy.model.DashboardAlert;
import com.alertmigrator.legacy.model.NotificationChannel;
import com.alertmigrator.service.core.store.LegacyAlertStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.List;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcLegacyAlertStore implements LegacyAlertStore {

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;

    public JdbcLegacyAlertStore(NamedParameterJdbcTemplate jdbc, ObjectMapper mapper) {
        this.jdbc = jdbc;
        this.json = new JsonColumns(mapper);
    }

    @Override
    public List<DashboardAlert> findAlerts(long orgId) {
        return jdbc.query(
                """
                select id, org_id, dashboard_id, panel_id, name, message, state, frequency, for_seconds, settings
                from alert
                where org_id = :org
                order by id
                """,
                new MapSqlParameterSource("org", orgId),
                (rs, i) -> new DashboardAlert(
                        rs.getLong("id"),
                        rs.getLong("org_id"),
                        rs.getLong("dashboard_id"),
                        rs.getLong("panel_id"),
                        rs.getString("name"),
                        rs.getString("message"),
                        rs.getString("state"),
                        rs.getLong("frequency"),
                        Duration.ofSeconds(rs.getLong("for_seconds")),
                        json.readTree(rs.getString("settings"))));
    }

    @Override
    public List<NotificationChannel> findChannels(long orgId) {
        return jdbc.query(
                """
                select id, org_id, uid, name, type, is_default, disable_resolve_message, settings, secure_settings,
                       send_reminder, frequency
                from alert_notification
                where org_id = :org
                order by id
                """,
                new MapSqlParameterSource("org", orgId),
                (rs, i) -> new NotificationChannel(
                        rs.getLong("id"),
                        rs.getLong("org_id"),
                        rs.getString("uid") == null ? "" : rs.getString("uid"),
                        rs.getString("name"),
                        rs.getString("type"),
                        rs.getBoolean("is_default"),
                        rs.getBoolean("disable_resolve_message"),
                        json.readTree(rs.getString("settings")),
                        json.readStringMap(rs.getString("secure_settings")),
                        rs.getBoolean("send_reminder"),
                        Duration.ofSeconds(rs.getLong("frequency"))));
    }
}
