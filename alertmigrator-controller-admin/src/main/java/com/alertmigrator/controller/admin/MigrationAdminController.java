package com.alertmigrator.controller.admin;

import static com.alertmigrator.service.core.support.MigrationConstants.ANY_ORG;

import com.alertmigrator.service.core.migration.MigrationRunSummary;
import com.alertmigrator.service.core.migration.MigrationService;
import com.alertmigrator.service.core.migration.OrgMigrationState;
import com.alertmigrator.service.core.migration.OrgRevertSummary;
import com.alertmigrator.service.core.migration.init.MigrationInitCoordinator;
import com.alertmigrator.service.core.telemetry.MigrationTelemetryRegistry;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/** Admin/ops endpoints to run, inspect and revert the alert migration. */
@RestController
@RequestMapping("/admin/migration")
public class MigrationAdminController {
    private final MigrationInitCoordinator coordinator;
    private final MigrationService migrationService;
    private final MigrationTelemetryRegistry telemetry;

    public MigrationAdminController(
            MigrationInitCoordinator coordinator,
            MigrationService migrationService,
            MigrationTelemetryRegistry telemetry) {
        this.coordinator = coordinator;
        this.migrationService = migrationService;
        this.telemetry = telemetry;
    }

    @PostMapping("/run")
    public MigrationRunSummary run() {
        return coordinator.run("admin");
    }

    @PostMapping("/orgs/{orgId}/revert")
    public OrgRevertSummary revertOrg(@PathVariable long orgId) {
        requireOrgId(orgId);
        return coordinator.exclusive("admin-revert-org", () -> migrationService.revertOrg(orgId));
    }

    @PostMapping("/revert")
    public List<OrgRevertSummary> revertAll() {
        return coordinator.exclusive("admin-revert-all", migrationService::revertAllOrgs);
    }

    @GetMapping("/orgs/{orgId}")
    public ResponseEntity<OrgMigrationState> state(@PathVariable long orgId) {
        requireOrgId(orgId);
        return migrationService
                .getOrgMigrationState(orgId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        return Map.of("migrated", migrationService.isMigrated(ANY_ORG));
    }

    @GetMapping("/telemetry")
    public MigrationTelemetryRegistry.Snapshot telemetry() {
        return telemetry.snapshot();
    }

    private static void requireOrgId(long orgId) {
        if (orgId <= 0) {
            throw new IllegalArgumentException("orgId must be positive: " + orgId);
        }
    }
}
