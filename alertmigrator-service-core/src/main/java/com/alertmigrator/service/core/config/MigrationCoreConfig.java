package com.alertmigrator.service.core.config;

import com.alertmigrator.service.core.secrets.AesGcmSecretsService;
import com.alertmigrator.service.core.secrets.SecretsService;
import com.alertmigrator.service.core.uid.RandomShortUidGenerator;
import com.alertmigrator.service.core.uid.ShortUidGenerator;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class MigrationCoreConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock migrationClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ShortUidGenerator shortUidGenerator() {
        return new RandomShortUidGenerator();
    }

    @Bean
    @ConditionalOnMissingBean
    public SecretsService secretsService(MigrationProperties properties) {
        String key = properties.getSecrets().getKey();
        if (key == null || key.isBlank()) {
            log.warn("alertmigrator.secrets.key not set; using a random key, secure settings will not survive a restart");
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            return new AesGcmSecretsService(random);
        }
        return new AesGcmSecretsService(Base64.getDecoder().decode(key.trim()));
    }
}
