package com.alertmigrator.service.core.migration;

public record OrgRevertSummary(
        long orgId, int rulesDeleted, int configsDeleted, int foldersDeleted, boolean silencesDeleted) {

    public OrgRevertSummary withSilencesDeleted(boolean deleted) {
        return new OrgRevertSummary(orgId, rulesDeleted, configsDeleted, foldersDeleted, deleted);
    }
}
