package com.alertmigrator.service.storage.impl;

import com.alertmigrator.dashboard.model.Dashboard;
import com.alertmigrator.dashboard.model.DashboardAclItem;
import com.alertmigrator.dashboard.model.Folder;
import com.alertmigrator.service.core.store.DashboardFolderStore;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

/** Folders live in the dashboard table with {@code is_folder = true}. */
@Repository
@RequiredArgsConstructor
public class JdbcDashboardFolderStore implements DashboardFolderStore {

    private static final RowMapper<Folder> FOLDER =
            (rs, i) -> new Folder(rs.getLong("id"), rs.getLong("org_id"), rs.getString("uid"), rs.getString("title"));

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public Optional<Dashboard> findDashboard(long orgId, long dashboardId) {
        List<Dashboard> rows = jdbc.query(
                """
                select id, org_id, uid, title, folder_id, has_acl
                from dashboard
                where org_id = :org and id = :id and is_folder = false
                """,
                new MapSqlParameterSource().addValue("org", orgId).addValue("id", dashboardId),
                (rs, i) -> mapDashboard(rs));
        return rows.stream().findFirst();
    }

    @Override
    public Optional<Folder> findFolderById(long orgId, long folderId) {
        return jdbc
                .query(
                        "select id, org_id, uid, title from dashboard where org_id = :org and id = :id and is_folder = true",
                        new MapSqlParameterSource().addValue("org", orgId).addValue("id", folderId),
                        FOLDER)
                .stream()
                .findFirst();
    }

    @Override
    public Optional<Folder> findFolderByTitle(long orgId, String title) {
        return jdbc
                .query(
                        """
                        select id, org_id, uid, title
                        from dashboard
                        where org_id = :org and title = :title and is_folder = true and folder_id = 0
                        order by id
                        """,
                        new MapSqlParameterSource().addValue("org", orgId).addValue("title", title),
                        FOLDER)
                .stream()
                .findFirst();
    }

    @Override
    public Folder createFolder(long orgId, String uid, String title, long createdBy) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("org", orgId)
                .addValue("uid", uid)
                .addValue("title", title)
                .addValue("createdBy", createdBy);
        jdbc.update(
                """
                insert into dashboard (org_id, uid, title, folder_id, is_folder, has_acl, created_by)
                values (:org, :uid, :title, 0, true, false, :createdBy)
                """,
                params);
        return jdbc.queryForObject(
                "select id, org_id, uid, title from dashboard where org_id = :org and uid = :uid", params, FOLDER);
    }

    @Override
    public int deleteFolder(long orgId, String uid) {
        MapSqlParameterSource params =
                new MapSqlParameterSource().addValue("org", orgId).addValue("uid", uid);
        jdbc.update(
                """
                delete from dashboard_acl
                where org_id = :org
                  and dashboard_id in (select id from dashboard where org_id = :org and uid = :uid and is_folder = true)
                """,
                params);
        return jdbc.update("delete from dashboard where org_id = :org and uid = :uid and is_folder = true", params);
    }

    @Override
    public List<DashboardAclItem> findAcl(long orgId, long dashboardId) {
        return jdbc.query(
                """
                select user_id, team_id, role, permission
                from dashboard_acl
                where org_id = :org and dashboard_id = :dashboard
                order by id
                """,
                new MapSqlParameterSource().addValue("org", orgId).addValue("dashboard", dashboardId),
                (rs, i) -> new DashboardAclItem(
                        nullableLong(rs, "user_id"),
                        nullableLong(rs, "team_id"),
                        rs.getString("role"),
                        rs.getInt("permission")));
    }

    @Override
    public void replaceAcl(long orgId, long folderId, List<DashboardAclItem> items) {
        MapSqlParameterSource target =
                new MapSqlParameterSource().addValue("org", orgId).addValue("dashboard", folderId);
        jdbc.update("delete from dashboard_acl where org_id = :org and dashboard_id = :dashboard", target);
        if (!items.isEmpty()) {
            SqlParameterSource[] batch = items.stream()
                    .map(item -> new MapSqlParameterSource()
                            .addValue("org", orgId)
                            .addValue("dashboard", folderId)
                            .addValue("user", item.userId())
                            .addValue("team", item.teamId())
                            .addValue("role", item.role())
                            .addValue("permission", item.permission()))
                    .toArray(SqlParameterSource[]::new);
            jdbc.batchUpdate(
                    """
                    insert into dashboard_acl (org_id, dashboard_id, user_id, team_id, role, permission)
                    values (:org, :dashboard, :user, :team, :role, :permission)
                    """,
                    batch);
        }
        jdbc.update(
                "update dashboard set has_acl = true where org_id = :org and id = :dashboard", target);
    }

    private static Dashboard mapDashboard(ResultSet rs) throws SQLException {
        return new Dashboard(
                rs.getLong("id"),
                rs.getLong("org_id"),
                rs.getString("uid"),
                rs.getString("title"),
                rs.getLong("folder_id"),
                rs.getBoolean("has_acl"));
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
