package com.alertmigrator.service.storage.impl;

import static org.assertj.core.api.Assertions.assertThat;

import com.alertmigrator.dashboard.model.Dashboard;
import com.alertmigrator.dashboard.model.DashboardAclItem;
import com.alertmigrator.dashboard.model.Folder;
import java.util.List;
import org.junit.jupiter.api.Test;

class JdbcDashboardFolderStoreTest {

    private final H2Database db = new H2Database();
    private final JdbcDashboardFolderStore store = new JdbcDashboardFolderStore(db.jdbc);

    @Test
    void findsDashboardsButNotFoldersAsDashboards() {
        long folderId = db.dashboard(1, "folder-1", "Ops", 0, true, false);
        long dashboardId = db.dashboard(1, "dash-1", "Hosts", folderId, false, true);

        assertThat(store.findDashboard(1, dashboardId))
                .contains(new Dashboard(dashboardId, 1, "dash-1", "Hosts", folderId, true));
        assertThat(store.findDashboard(1, folderId)).isEmpty();
        assertThat(store.findDashboard(2, dashboardId)).isEmpty();
        assertThat(store.findFolderById(1, folderId)).map(Folder::uid).contains("folder-1");
        assertThat(store.findFolderById(1, dashboardId)).isEmpty();
    }

    @Test
    void createdFolderCanBeFoundByTitleAndDeleted() {
        Folder created = store.createFolder(1, "new-folder", "General Alerting", -8);

        assertThat(created.id()).isPositive();
        assertThat(created.uid()).isEqualTo("new-folder");
        assertThat(store.findFolderByTitle(1, "General Alerting")).contains(created);
        assertThat(store.findFolderByTitle(2, "General Alerting")).isEmpty();

        assertThat(store.deleteFolder(1, "new-folder")).isEqualTo(1);
        assertThat(store.deleteFolder(1, "new-folder")).isZero();
        assertThat(store.findFolderById(1, created.id())).isEmpty();
    }

    @Test
    void replaceAclCopiesPermissionsOntoFolder() {
        long dashboardId = db.dashboard(1, "dash-1", "Hosts", 0, false, true);
        db.acl(1, dashboardId, 7L, null, 4);
        db.acl(1, dashboardId, null, "Editor", 2);
        Folder folder = store.createFolder(1, "acl-folder", "Hosts Alerts - dash-1", -8);

        List<DashboardAclItem> acl = store.findAcl(1, dashboardId);
        store.replaceAcl(1, folder.id(), acl);

        assertThat(acl).containsExactly(
                new DashboardAclItem(7L, null, null, 4), new DashboardAclItem(null, null, "Editor", 2));
        assertThat(store.findAcl(1, folder.id())).containsExactlyElementsOf(acl);

        store.deleteFolder(1, "acl-folder");
        assertThat(store.findAcl(1, folder.id())).isEmpty();
        assertThat(store.findAcl(1, dashboardId)).hasSize(2);
    }
}
