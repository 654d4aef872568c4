package com.alertmigrator.service.storage.impl;

import com.alertmigrator.service.core.store.AlertmanagerConfigStore;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Keeps every saved configuration row; the latest one per org is current. */
@Repository
public class JdbcAlertmanagerConfigStore implements AlertmanagerConfigStore {
    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public JdbcAlertmanagerConfigStore(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public void save(long orgId, String configuration, String configurationVersion) {
        jdbc.update(
                """
                insert into alert_configuration (org_id, alertmanager_configuration, configuration_version, created_at,
                                                 is_default)
                values (:org, :cfg, :version, :created, false)
                """,
                new MapSqlParameterSource()
                        .addValue("org", orgId)
                        .addValue("cfg", configuration)
                        .addValue("version", configurationVersion)
                        .addValue("created", Timestamp.from(clock.instant())));
    }

    @Override
    public Optional<StoredConfig> find(long orgId) {
        List<StoredConfig> rows = jdbc.query(
                """
                select org_id, alertmanager_configuration, configuration_version, created_at
                from alert_configuration
                where org_id = :org
                order by id desc
                """,
                new MapSqlParameterSource("org", orgId),
                (rs, i) -> new StoredConfig(
                        rs.getLong("org_id"),
                        rs.getString("alertmanager_configuration"),
                        rs.getString("configuration_version"),
                        rs.getTimestamp("created_at").toInstant()));
        return rows.stream().findFirst();
    }

    @Override
    public int delete(long orgId) {
        return jdbc.update(
                "delete from alert_configuration where org_id = :org", new MapSqlParameterSource("org", orgId));
    }
}
