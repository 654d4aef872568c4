package com.alertmigrator.service.core.migration.init;

public class MigrationInProgressException extends RuntimeException {
    public MigrationInProgressException(String operation) {
        super("another migration operation is running; rejected " + operation);
    }
}
