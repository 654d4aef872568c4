package com.alertmigrator.service.core.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "alertmigrator")
public class MigrationProperties {
    /** Unified alerting enabled. When false a run only clears the global migrated flag. */
    private boolean enabled = true;

    private boolean forceMigration = false;
    private boolean runOnStartup = false;
    private String dataPath = "data";
    /** Set for stores with case-insensitive collation (MySQL-compatible). */
    private boolean caseInsensitiveUids = false;

    private Secrets secrets = new Secrets();
    private DatasourceCacheConfig datasourceCache = new DatasourceCacheConfig();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isForceMigration() {
        return forceMigration;
    }

    public void setForceMigration(boolean forceMigration) {
        this.forceMigration = forceMigration;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }

    public String getDataPath() {
        return dataPath;
    }

    public void setDataPath(String dataPath) {
        this.dataPath = dataPath;
    }

    public boolean isCaseInsensitiveUids() {
        return caseInsensitiveUids;
    }

    public void setCaseInsensitiveUids(boolean caseInsensitiveUids) {
        this.caseInsensitiveUids = caseInsensitiveUids;
    }

    public Secrets getSecrets() {
        return secrets;
    }

    public void setSecrets(Secrets secrets) {
        this.secrets = secrets;
    }

    public DatasourceCacheConfig getDatasourceCache() {
        return datasourceCache;
    }

    public void setDatasourceCache(DatasourceCacheConfig datasourceCache) {
        this.datasourceCache = datasourceCache;
    }

    public static class Secrets {
        /** Base64 encoded AES key (16, 24 or 32 bytes). */
        private String key;

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }
    }

    public static class DatasourceCacheConfig {
        private Duration ttl = Duration.ofMinutes(5);
        private long maximumSize = 1_000;

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public long getMaximumSize() {
            return maximumSize;
        }

        public void setMaximumSize(long maximumSize) {
            this.maximumSize = maximumSize;
        }
    }
}
