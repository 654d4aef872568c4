package com.alertmigrator.unified.model;

import java.time.Instant;
import java.util.List;

/** A mute entry suppressing notifications for alerts matching every matcher. */
public record Silence(
        String id,
        List<ObjectMatcher> matchers,
        Instant startsAt,
        Instant endsAt,
        String createdBy,
        String comment,
        Instant expiresAt) {

    public Silence {
        matchers = matchers == null ? List.of() : List.copyOf(matchers);
    }
}
