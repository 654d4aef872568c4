package com.alertmigrator.service.core.channel;

import com.alertmigrator.service.core.secrets.SecretsService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Moves settings that must be secret for a channel type out of the plaintext settings and encrypts every secure
 * value. Legacy rows written before those fields became secret still carry them in plaintext.
 */
@Component
@RequiredArgsConstructor
public class SecureSettingsMigrator {

    private final SecretsService secretsService;

    public MigratedSettings migrate(String channelType, JsonNode settings, Map<String, String> legacySecureSettings) {
        ObjectNode cleaned = settings != null && settings.isObject()
                ? ((ObjectNode) settings).deepCopy()
                : JsonNodeFactory.instance.objectNode();

        Map<String, String> secure = new LinkedHashMap<>();
        legacySecureSettings.forEach((k, v) -> secure.put(k, secretsService.decryptFromBase64(v)));

        for (String key : ChannelType.secureKeysFor(channelType)) {
            String existing = secure.get(key);
            if (existing != null && !existing.isEmpty()) {
                continue;
            }
            JsonNode plain = cleaned.get(key);
            if (plain != null && plain.isTextual() && !plain.asText().isEmpty()) {
                secure.put(key, plain.asText());
                cleaned.remove(key);
            }
        }

        Map<String, String> encrypted = new LinkedHashMap<>();
        secure.forEach((k, v) -> encrypted.put(k, secretsService.encryptToBase64(v)));
        return new MigratedSettings(cleaned, encrypted);
    }

    /** {@code secureSettings} values are base64 encoded ciphertexts. */
    public record MigratedSettings(ObjectNode settings, Map<String, String> secureSettings) {}
}
