package com.alertmigrator.service.storage.impl;

import java.util.UUID;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

/** Fresh in-memory database per test with the production schema applied. */
final class H2Database {

    final DriverManagerDataSource dataSource;
    final NamedParameterJdbcTemplate jdbc;

    H2Database() {
        dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");
        new ResourceDatabasePopulator(new ClassPathResource("db/alertmigrator-schema.sql")).execute(dataSource);
        jdbc = new NamedParameterJdbcTemplate(dataSource);
    }

    TransactionTemplate transactionTemplate() {
        return new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    void org(long id) {
        jdbc.update(
                "insert into org (id, name) values (:id, :name)",
                new MapSqlParameterSource().addValue("id", id).addValue("name", "org-" + id));
    }

    long dashboard(long orgId, String uid, String title, long folderId, boolean isFolder, boolean hasAcl) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("org", orgId)
                .addValue("uid", uid)
                .addValue("title", title)
                .addValue("folder", folderId)
                .addValue("isFolder", isFolder)
                .addValue("hasAcl", hasAcl);
        jdbc.update(
                """
                insert into dashboard (org_id, uid, title, folder_id, is_folder, has_acl)
                values (:org, :uid, :title, :folder, :isFolder, :hasAcl)
                """,
                params);
        return jdbc.queryForObject("select id from dashboard where org_id = :org and uid = :uid", params, Long.class);
    }

    void acl(long orgId, long dashboardId, Long userId, String role, int permission) {
        jdbc.update(
                """
                insert into dashboard_acl (org_id, dashboard_id, user_id, role, permission)
                values (:org, :dashboard, :user, :role, :permission)
                """,
                new MapSqlParameterSource()
                        .addValue("org", orgId)
                        .addValue("dashboard", dashboardId)
                        .addValue("user", userId)
                        .addValue("role", role)
                        .addValue("permission", permission));
    }

    long datasource(long orgId, String uid, String name, String type) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("org", orgId)
                .addValue("uid", uid)
                .addValue("name", name)
                .addValue("type", type);
        jdbc.update("insert into data_source (org_id, uid, name, type) values (:org, :uid, :name, :type)", params);
        return jdbc.queryForObject("select id from data_source where org_id = :org and uid = :uid", params, Long.class);
    }

    void channel(long orgId, String uid, String name, String type, boolean isDefault, String settings) {
        jdbc.update(
                """
                insert into alert_notification (org_id, uid, name, type, is_default, settings, secure_settings)
                values (:org, :uid, :name, :type, :isDefault, :settings, '{}')
                """,
                new MapSqlParameterSource()
                        .addValue("org", orgId)
                        .addValue("uid", uid)
                        .addValue("name", name)
                        .addValue("type", type)
                        .addValue("isDefault", isDefault)
                        .addValue("settings", settings));
    }

    void alert(long orgId, long dashboardId, long panelId, String name, String settings) {
        jdbc.update(
                """
                insert into alert (org_id, dashboard_id, panel_id, name, message, state, frequency, for_seconds, settings)
                values (:org, :dashboard, :panel, :name, 'Value is ${value}', 'alerting', 60, 300, :settings)
                """,
                new MapSqlParameterSource()
                        .addValue("org", orgId)
                        .addValue("dashboard", dashboardId)
                        .addValue("panel", panelId)
                        .addValue("name", name)
                        .addValue("settings", settings));
    }

    int count(String table, long orgId) {
        return jdbc.queryForObject(
                "select count(*) from " + table + " where org_id = :org",
                new MapSqlParameterSource("org", orgId),
                Integer.class);
    }
}
