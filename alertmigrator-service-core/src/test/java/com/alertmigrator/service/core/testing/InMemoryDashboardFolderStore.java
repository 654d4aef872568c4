package com.alertmigrator.service.core.testing;

import com.alertmigrator.dashboard.model.Dashboard;
import com.alertmigrator.dashboard.model.DashboardAclItem;
import com.alertmigrator.dashboard.model.Folder;
import com.alertmigrator.service.core.store.DashboardFolderStore;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryDashboardFolderStore implements DashboardFolderStore {
    public final Map<Long, Dashboard> dashboards = new HashMap<>();
    public final List<Folder> folders = new ArrayList<>();
    public final Map<Long, List<DashboardAclItem>> acls = new HashMap<>();
    public final List<Folder> created = new ArrayList<>();
    private long nextId = 1000;

    public Dashboard dashboard(long orgId, long id, String uid, String title, long folderId, boolean hasAcl) {
        Dashboard dashboard = new Dashboard(id, orgId, uid, title, folderId, hasAcl);
        dashboards.put(id, dashboard);
        return dashboard;
    }

    public Folder folder(long orgId, long id, String uid, String title) {
        Folder folder = new Folder(id, orgId, uid, title);
        folders.add(folder);
        return folder;
    }

    @Override
    public Optional<Dashboard> findDashboard(long orgId, long dashboardId) {
        return Optional.ofNullable(dashboards.get(dashboardId)).filter(d -> d.orgId() == orgId);
    }

    @Override
    public Optional<Folder> findFolderById(long orgId, long folderId) {
        return folders.stream()
                .filter(f -> f.orgId() == orgId && f.id() == folderId)
                .findFirst();
    }

    @Override
    public Optional<Folder> findFolderByTitle(long orgId, String title) {
        return folders.stream()
                .filter(f -> f.orgId() == orgId && f.title().equals(title))
                .findFirst();
    }

    @Override
    public Folder createFolder(long orgId, String uid, String title, long createdBy) {
        Folder folder = new Folder(nextId++, orgId, uid, title);
        folders.add(folder);
        created.add(folder);
        return folder;
    }

    @Override
    public int deleteFolder(long orgId, String uid) {
        Optional<Folder> folder = folders.stream()
                .filter(f -> f.orgId() == orgId && f.uid().equals(uid))
                .findFirst();
        folder.ifPresent(f -> {
            folders.remove(f);
            acls.remove(f.id());
        });
        return folder.isPresent() ? 1 : 0;
    }

    @Override
    public List<DashboardAclItem> findAcl(long orgId, long dashboardId) {
        return acls.getOrDefault(dashboardId, List.of());
    }

    @Override
    public void replaceAcl(long orgId, long folderId, List<DashboardAclItem> items) {
        acls.put(folderId, List.copyOf(items));
    }
}
