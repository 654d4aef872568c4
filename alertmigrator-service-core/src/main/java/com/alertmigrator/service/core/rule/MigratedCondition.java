package com.alertmigrator.service.core.rule;

import com.alertmigrator.unified.model.AlertQuery;
import java.util.List;

/** Queries of a migrated rule plus the refId of the expression that decides whether it fires. */
public record MigratedCondition(String condition, List<AlertQuery> data) {
    public MigratedCondition {
        data = List.copyOf(data);
    }
}
