package com.alertmigrator.service.core.migration.init;

import com.alertmigrator.service.core.config.MigrationProperties;
import com.alertmigrator.service.core.migration.MigrationRunSummary;
import com.alertmigrator.service.core.migration.MigrationService;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Serializes migration runs and reverts inside this process, and runs the migration once on startup when
 * {@code alertmigrator.run-on-startup} is set.
 */
@Component
public class MigrationInitCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MigrationInitCoordinator.class);

    private final MigrationService migrationService;
    private final MigrationProperties properties;
    private final ReentrantLock lock = new ReentrantLock();

    public MigrationInitCoordinator(MigrationService migrationService, MigrationProperties properties) {
        this.migrationService = migrationService;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (!properties.isRunOnStartup()) {
            log.debug("Migration on startup disabled; skip");
            return;
        }
        log.info(
                "Migration startup: enabled={}, force={}",
                properties.isEnabled(),
                properties.isForceMigration());
        MigrationRunSummary summary = exclusive("startup", migrationService::run);
        log.info(
                "Migration startup finished: migrated={} skipped={}",
                summary.migrated().size(),
                summary.skipped().size());
    }

    public MigrationRunSummary run(String reason) {
        return exclusive(reason, migrationService::run);
    }

    /**
     * Runs {@code operation} unless another one holds the lock.
     *
     * @throws MigrationInProgressException when another operation is running
     */
    public <T> T exclusive(String reason, Supplier<T> operation) {
        if (!lock.tryLock()) {
            log.debug("Migration operation already running; skip ({})", reason);
            throw new MigrationInProgressException(reason);
        }
        long t0 = System.nanoTime();
        try {
            log.debug("Migration operation starting (reason={})", reason);
            return operation.get();
        } finally {
            lock.unlock();
            long ms = (System.nanoTime() - t0) / 1_000_000L;
            log.debug("Migration operation finished (reason={}) in {} ms", reason, ms);
        }
    }
}
