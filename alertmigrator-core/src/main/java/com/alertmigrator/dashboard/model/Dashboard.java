package com.alertmigrator.dashboard.model;

/** Dashboard as seen by the migration. {@code folderId} is 0 for dashboards in the general folder. */
public record Dashboard(long id, long orgId, String uid, String title, long folderId, boolean hasAcl) {}
