package com.alertmigrator.dashboard.model;

public record Datasource(long id, long orgId, String uid, String name, String type) {}
