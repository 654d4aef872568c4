package com.alertmigrator.unified.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Duration;

/** Query window relative to evaluation time, both bounds in seconds before now. */
public record RelativeTimeRange(long from, long to) {

    public static RelativeTimeRange of(Duration from, Duration to) {
        return new RelativeTimeRange(from.toSeconds(), to.toSeconds());
    }

    @JsonIgnore
    public Duration fromDuration() {
        return Duration.ofSeconds(from);
    }

    @JsonIgnore
    public Duration toDuration() {
        return Duration.ofSeconds(to);
    }
}
