package com.alertmigrator.service.core.telemetry;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

@Component
@Primary
public class MigrationTelemetryRegistry implements MigrationTelemetry {
    private final LongAdder orgsMigrated = new LongAdder();
    private final LongAdder orgsSkipped = new LongAdder();
    private final LongAdder orgsReverted = new LongAdder();
    private final LongAdder orgsFailed = new LongAdder();
    private final LongAdder rulesMigrated = new LongAdder();
    private final LongAdder receiversMigrated = new LongAdder();
    private final LongAdder silencesWritten = new LongAdder();

    private final Map<WarningKind, LongAdder> warnings = new ConcurrentHashMap<>();

    @Override
    public void recordOrgMigrated(long orgId, int rules, int receivers) {
        orgsMigrated.increment();
        rulesMigrated.add(rules);
        receiversMigrated.add(receivers);
    }

    @Override
    public void recordOrgSkipped(long orgId) {
        orgsSkipped.increment();
    }

    @Override
    public void recordOrgReverted(long orgId) {
        orgsReverted.increment();
    }

    @Override
    public void recordOrgFailed(long orgId) {
        orgsFailed.increment();
    }

    @Override
    public void recordSilencesWritten(long orgId, int silences) {
        if (silences > 0) {
            silencesWritten.add(silences);
        }
    }

    @Override
    public void recordWarning(WarningKind kind) {
        warnings.computeIfAbsent(kind, key -> new LongAdder()).increment();
    }

    public Snapshot snapshot() {
        Map<WarningKind, Long> warningCounts = new EnumMap<>(WarningKind.class);
        warnings.forEach((kind, adder) -> warningCounts.put(kind, adder.sum()));
        return new Snapshot(
                orgsMigrated.sum(),
                orgsSkipped.sum(),
                orgsReverted.sum(),
                orgsFailed.sum(),
                rulesMigrated.sum(),
                receiversMigrated.sum(),
                silencesWritten.sum(),
                warningCounts);
    }

    public record Snapshot(
            long orgsMigrated,
            long orgsSkipped,
            long orgsReverted,
            long orgsFailed,
            long rulesMigrated,
            long receiversMigrated,
            long silencesWritten,
            Map<WarningKind, Long> warnings) {}
}
