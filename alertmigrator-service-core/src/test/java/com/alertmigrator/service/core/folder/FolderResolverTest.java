package com.alertmigrator.service.core.folder;

import static org.assertj.core.api.Assertions.assertThat;

import com.alertmigrator.dashboard.model.Dashboard;
import com.alertmigrator.dashboard.model.DashboardAclItem;
import com.alertmigrator.dashboard.model.Folder;
import com.alertmigrator.service.core.migration.OrgMigrationContext;
import com.alertmigrator.service.core.telemetry.MigrationTelemetry.WarningKind;
import com.alertmigrator.service.core.telemetry.MigrationTelemetryRegistry;
import com.alertmigrator.service.core.testing.InMemoryDashboardFolderStore;
import com.alertmigrator.service.core.testing.SequentialUidGenerator;
import java.util.List;
import org.junit.jupiter.api.Test;

class FolderResolverTest {

    private final InMemoryDashboardFolderStore store = new InMemoryDashboardFolderStore();
    private final MigrationTelemetryRegistry telemetry = new MigrationTelemetryRegistry();
    private final FolderResolver resolver = new FolderResolver(store, telemetry);
    private final OrgMigrationContext ctx = new OrgMigrationContext(1, false, new SequentialUidGenerator("f"), List.of());

    @Test
    void dashboardInExistingFolderKeepsIt() {
        Folder ops = store.folder(1, 50, "ops", "Ops");
        Dashboard dashboard = store.dashboard(1, 10, "d1", "Hosts", 50, false);

        assertThat(resolver.resolve(ctx, dashboard)).isEqualTo(ops);
        assertThat(ctx.createdFolderUids()).isEmpty();
    }

    @Test
    void generalFolderIsCreatedOnceAndReused() {
        Dashboard first = store.dashboard(1, 10, "d1", "Hosts", 0, false);
        Dashboard second = store.dashboard(1, 11, "d2", "Disks", 0, false);

        Folder a = resolver.resolve(ctx, first);
        Folder b = resolver.resolve(ctx, second);

        assertThat(a).isEqualTo(b);
        assertThat(a.title()).isEqualTo("General Alerting");
        assertThat(store.created).hasSize(1);
        assertThat(ctx.createdFolderUids()).containsExactly(a.uid());
    }

    @Test
    void existingGeneralFolderIsNotRecordedAsCreated() {
        Folder general = store.folder(1, 60, "general", "General Alerting");

        assertThat(resolver.resolve(ctx, store.dashboard(1, 10, "d1", "Hosts", 0, false))).isEqualTo(general);
        assertThat(ctx.createdFolderUids()).isEmpty();
    }

    @Test
    void orphanedDashboardFallsBackToGeneralFolder() {
        Dashboard orphan = store.dashboard(1, 10, "d1", "Hosts", 404, false);

        assertThat(resolver.resolve(ctx, orphan).title()).isEqualTo("General Alerting");
        assertThat(telemetry.snapshot().warnings()).containsEntry(WarningKind.ORPHANED_DASHBOARD, 1L);
    }

    @Test
    void dashboardWithAclGetsOwnFolderWithCopiedPermissions() {
        Dashboard dashboard = store.dashboard(1, 10, "d1", "Hosts", 50, true);
        List<DashboardAclItem> acl = List.of(new DashboardAclItem(3L, null, null, 4));
        store.acls.put(10L, acl);

        Folder folder = resolver.resolve(ctx, dashboard);

        assertThat(folder.title()).isEqualTo("Hosts Alerts - d1");
        assertThat(store.acls.get(folder.id())).isEqualTo(acl);
        assertThat(resolver.resolve(ctx, dashboard)).isEqualTo(folder);
        assertThat(ctx.createdFolderUids()).containsExactly(folder.uid());
    }

    @Test
    void folderNameIsCappedAt255Characters() {
        Dashboard dashboard = new Dashboard(10, 1, "abcdefghij", "x".repeat(400), 0, true);

        String name = FolderResolver.folderName(dashboard);

        assertThat(name).hasSize(255).endsWith(" Alerts - abcdefghij").startsWith("xxx");
    }
}
