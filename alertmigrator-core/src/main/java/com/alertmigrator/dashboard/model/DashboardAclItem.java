package com.alertmigrator.dashboard.model;

/** One permission entry of a dashboard or folder. Exactly one of user, team or role is set. */
public record DashboardAclItem(Long userId, Long teamId, String role, int permission) {}
