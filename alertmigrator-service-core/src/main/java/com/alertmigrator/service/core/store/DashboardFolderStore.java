package com.alertmigrator.service.core.store;

import com.alertmigrator.dashboard.model.Dashboard;
import com.alertmigrator.dashboard.model.DashboardAclItem;
import com.alertmigrator.dashboard.model.Folder;
import java.util.List;
import java.util.Optional;

/** The slice of the dashboard and folder service the migration needs. */
public interface DashboardFolderStore {
    Optional<Dashboard> findDashboard(long orgId, long dashboardId);

    Optional<Folder> findFolderById(long orgId, long folderId);

    Optional<Folder> findFolderByTitle(long orgId, String title);

    Folder createFolder(long orgId, String uid, String title, long createdBy);

    /** @return number of folders deleted, 0 when the folder is already gone */
    int deleteFolder(long orgId, String uid);

    List<DashboardAclItem> findAcl(long orgId, long dashboardId);

    void replaceAcl(long orgId, long folderId, List<DashboardAclItem> items);
}
