package com.alertmigrator.service.storage.impl;

import com.alertmigrator.service.core.migration.OrgMigrationState;
import com.alertmigrator.service.core.store.MigrationStateStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcMigrationStateStore implements MigrationStateStore {
    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;

    public JdbcMigrationStateStore(NamedParameterJdbcTemplate jdbc, ObjectMapper mapper) {
        this.jdbc = jdbc;
        this.json = new JsonColumns(mapper);
    }

    @Override
    public Optional<OrgMigrationState> find(long orgId) {
        List<OrgMigrationState> rows = jdbc.query(
                """
                select org_id, migrated, created_folders, version, updated_at
                from alert_migration_state
                where org_id = :org
                """,
                new MapSqlParameterSource("org", orgId),
                (rs, i) -> new OrgMigrationState(
                        rs.getLong("org_id"),
                        rs.getBoolean("migrated"),
                        json.readStringList(rs.getString("created_folders")),
                        rs.getString("version"),
                        rs.getTimestamp("updated_at").toInstant()));
        return rows.stream().findFirst();
    }

    @Override
    public void save(OrgMigrationState state) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("org", state.orgId())
                .addValue("migrated", state.migrated())
                .addValue("folders", json.write(state.createdFolderUids()))
                .addValue("version", state.version())
                .addValue("updated", Timestamp.from(state.updatedAt()));
        int updated = jdbc.update(
                """
                update alert_migration_state
                set migrated = :migrated, created_folders = :folders, version = :version, updated_at = :updated
                where org_id = :org
                """,
                params);
        if (updated == 0) {
            jdbc.update(
                    """
                    insert into alert_migration_state (org_id, migrated, created_folders, version, updated_at)
                    values (:org, :migrated, :folders, :version, :updated)
                    """,
                    params);
        }
    }

    @Override
    public void delete(long orgId) {
        jdbc.update("delete from alert_migration_state where org_id = :org", new MapSqlParameterSource("org", orgId));
    }
}
