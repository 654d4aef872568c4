package com.alertmigrator.service.core.telemetry;

public interface MigrationTelemetry {
    void recordOrgMigrated(long orgId, int rules, int receivers);

    void recordOrgSkipped(long orgId);

    void recordOrgReverted(long orgId);

    void recordOrgFailed(long orgId);

    void recordSilencesWritten(long orgId, int silences);

    void recordWarning(WarningKind kind);

    /** Best-effort problems that are logged and skipped instead of failing the org. */
    enum WarningKind {
        DISCONTINUED_CHANNEL,
        REGENERATED_CHANNEL_UID,
        OBSOLETE_CHANNEL_REFERENCE,
        UNKNOWN_NO_DATA_STATE,
        UNKNOWN_EXEC_ERROR_STATE,
        ORPHANED_DASHBOARD,
        PROMETHEUS_BOTH_QUERY,
        SILENCE_FAILURE
    }
}
