package com.alertmigrator.service.core.uid;

/** Source of short, URL-safe identifiers for migrated entities. */
@FunctionalInterface
public interface ShortUidGenerator {
    String generate();
}
