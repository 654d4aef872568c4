package com.alertmigrator.dashboard.model;

public record Folder(long id, long orgId, String uid, String title) {}
