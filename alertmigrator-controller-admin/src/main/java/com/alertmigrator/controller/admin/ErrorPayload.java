package com.alertmigrator.controller.admin;

import java.time.Instant;

/** Structured error payload returned by the admin endpoints. */
public record ErrorPayload(Instant timestamp, int status, String error, String message, String path) {}
