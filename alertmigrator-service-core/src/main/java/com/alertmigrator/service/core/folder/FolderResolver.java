package com.alertmigrator.service.core.folder;

import static com.alertmigrator.service.core.support.MigrationConstants.DASHBOARD_FOLDER_TEMPLATE;
import static com.alertmigrator.service.core.support.MigrationConstants.FOLDER_CREATED_BY;
import static com.alertmigrator.service.core.support.MigrationConstants.GENERAL_FOLDER_TITLE;
import static com.alertmigrator.service.core.support.MigrationConstants.MAX_FOLDER_NAME_LENGTH;

import com.alertmigrator.dashboard.model.Dashboard;
import com.alertmigrator.dashboard.model.DashboardAclItem;
import com.alertmigrator.dashboard.model.Folder;
import com.alertmigrator.service.core.migration.OrgMigrationContext;
import com.alertmigrator.service.core.store.DashboardFolderStore;
import com.alertmigrator.service.core.telemetry.MigrationTelemetry;
import com.alertmigrator.service.core.telemetry.MigrationTelemetry.WarningKind;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Picks the folder that owns the rules migrated from a dashboard's alerts, in this order:
 *
 * <ol>
 *   <li>a dashboard with custom permissions gets its own folder carrying a copy of the dashboard ACL;
 *   <li>a dashboard inside a folder keeps that folder when it still exists;
 *   <li>everything else goes to the org's general alerting folder.
 * </ol>
 *
 * Folders created here are recorded in the context so a revert can delete them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FolderResolver {

    private final DashboardFolderStore store;
    private final MigrationTelemetry telemetry;

    public Folder resolve(OrgMigrationContext ctx, Dashboard dashboard) {
        if (dashboard.hasAcl()) {
            return aclFolder(ctx, dashboard);
        }
        if (dashboard.folderId() > 0) {
            Optional<Folder> folder = store.findFolderById(dashboard.orgId(), dashboard.folderId());
            if (folder.isPresent()) {
                return folder.get();
            }
            log.warn(
                    "Dashboard folder not found, using the general folder: orgId={} dashboardUid={} missingFolderId={}",
                    dashboard.orgId(),
                    dashboard.uid(),
                    dashboard.folderId());
            telemetry.recordWarning(WarningKind.ORPHANED_DASHBOARD);
        }
        return generalFolder(ctx);
    }

    private Folder aclFolder(OrgMigrationContext ctx, Dashboard dashboard) {
        String name = folderName(dashboard);
        Optional<Folder> cached = ctx.aclFolder(name);
        if (cached.isPresent()) {
            return cached.get();
        }
        log.info(
                "Creating folder for alerts of a dashboard with custom permissions: orgId={} folder={}",
                dashboard.orgId(),
                name);
        Folder folder = create(ctx, name);
        List<DashboardAclItem> acl = store.findAcl(dashboard.orgId(), dashboard.id());
        store.replaceAcl(folder.orgId(), folder.id(), acl);
        ctx.cacheAclFolder(name, folder);
        return folder;
    }

    private Folder generalFolder(OrgMigrationContext ctx) {
        Optional<Folder> cached = ctx.generalFolder();
        if (cached.isPresent()) {
            return cached.get();
        }
        Folder folder = store.findFolderByTitle(ctx.orgId(), GENERAL_FOLDER_TITLE)
                .orElseGet(() -> {
                    log.info("Creating general alerting folder: orgId={}", ctx.orgId());
                    return create(ctx, GENERAL_FOLDER_TITLE);
                });
        ctx.cacheGeneralFolder(folder);
        return folder;
    }

    private Folder create(OrgMigrationContext ctx, String title) {
        Folder folder = store.createFolder(ctx.orgId(), ctx.uids().generateUid(), title, FOLDER_CREATED_BY);
        ctx.recordCreatedFolder(folder.uid());
        return folder;
    }

    /** {@code "<title> Alerts - <uid>"}, the title cut so the whole fits in the folder name limit. */
    public static String folderName(Dashboard dashboard) {
        int maxTitle = MAX_FOLDER_NAME_LENGTH - String.format(DASHBOARD_FOLDER_TEMPLATE, "", dashboard.uid()).length();
        String title = dashboard.title() == null ? "" : dashboard.title();
        if (title.length() > maxTitle) {
            title = title.substring(0, Math.max(maxTitle, 0));
        }
        return String.format(DASHBOARD_FOLDER_TEMPLATE, title, dashboard.uid());
    }
}
