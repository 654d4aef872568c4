package com.alertmigrator.service.core.channel;

import com.alertmigrator.service.core.secrets.SecretsException;
import com.alertmigrator.service.core.secrets.SecretsService;
import com.alertmigrator.unified.model.IntegrationConfig;
import com.alertmigrator.unified.model.Receiver;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Builds every integration the way the notifier would at delivery time and rejects the ones that cannot work. */
@Component
@RequiredArgsConstructor
public class ReceiverValidator {

    private final SecretsService secretsService;

    public void validate(OrgReceivers receivers) {
        for (Receiver receiver : receivers.receivers()) {
            for (IntegrationConfig integration : receiver.integrations()) {
                validate(receiver.name(), integration);
            }
        }
    }

    void validate(String receiver, IntegrationConfig integration) {
        ChannelType type = ChannelType.fromValue(integration.type())
                .filter(t -> !t.discontinued())
                .orElseThrow(() -> new ReceiverValidationException(
                        receiver, integration.type(), "notifier type is not supported"));

        if (integration.uid() == null || integration.uid().isEmpty()) {
            throw new ReceiverValidationException(receiver, integration.type(), "integration has no UID");
        }

        Map<String, String> secrets = new HashMap<>();
        integration.secureSettings().forEach((key, encoded) -> {
            try {
                secrets.put(key, secretsService.decryptFromBase64(encoded));
            } catch (SecretsException ex) {
                throw new ReceiverValidationException(
                        receiver, integration.type(), "cannot decrypt secure setting " + key, ex);
            }
        });

        for (List<String> alternatives : type.required()) {
            boolean present = alternatives.stream().anyMatch(key -> isSet(integration.settings(), secrets, key));
            if (!present) {
                throw new ReceiverValidationException(
                        receiver,
                        integration.type(),
                        "could not find " + String.join(" or ", alternatives) + " property in settings");
            }
        }
    }

    private static boolean isSet(JsonNode settings, Map<String, String> secrets, String key) {
        String secret = secrets.get(key);
        if (secret != null && !secret.isEmpty()) {
            return true;
        }
        if (settings == null) {
            return false;
        }
        JsonNode value = settings.get(key);
        if (value == null || value.isNull()) {
            return false;
        }
        return !value.isTextual() || !value.asText().isBlank();
    }
}
