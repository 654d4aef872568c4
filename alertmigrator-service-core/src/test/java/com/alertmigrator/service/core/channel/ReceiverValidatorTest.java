package com.alertmigrator.service.core.channel;

import static com.alertmigrator.service.core.testing.Fixtures.json;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.alertmigrator.service.core.secrets.AesGcmSecretsService;
import com.alertmigrator.unified.model.IntegrationConfig;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ReceiverValidatorTest {

    private final AesGcmSecretsService secrets = new AesGcmSecretsService(new byte[32]);
    private final ReceiverValidator validator = new ReceiverValidator(secrets);

    @Test
    void requiredSettingMayComeFromSecureSettings() {
        IntegrationConfig slack = new IntegrationConfig(
                "u1", "Slack", "slack", false, json("{}"), Map.of("token", secrets.encryptToBase64("xoxb")));

        assertThatCode(() -> validator.validate("Slack", slack)).doesNotThrowAnyException();
    }

    @Test
    void missingRequiredSettingIsRejected() {
        IntegrationConfig email = new IntegrationConfig("u1", "Mail", "email", false, json("{}"), Map.of());

        assertThatThrownBy(() -> validator.validate("Mail", email))
                .isInstanceOf(ReceiverValidationException.class)
                .hasMessageContaining("could not find addresses property in settings")
                .hasMessageContaining("'Mail'");
    }

    @Test
    void everyRequiredGroupIsChecked() {
        IntegrationConfig telegram =
                new IntegrationConfig("u1", "Tg", "telegram", false, json("{\"chatid\":\"\"}"), Map.of(
                        "bottoken", secrets.encryptToBase64("t")));

        assertThatThrownBy(() -> validator.validate("Tg", telegram))
                .isInstanceOf(ReceiverValidationException.class)
                .hasMessageContaining("chatid");
    }

    @Test
    void unknownTypeIsRejected() {
        IntegrationConfig unknown = new IntegrationConfig("u1", "X", "carrier-pigeon", false, json("{}"), Map.of());

        assertThatThrownBy(() -> validator.validate("X", unknown))
                .isInstanceOf(ReceiverValidationException.class)
                .hasMessageContaining("notifier type is not supported");
    }

    @Test
    void undecryptableSecretIsRejected() {
        IntegrationConfig slack =
                new IntegrationConfig("u1", "Slack", "slack", false, json("{\"url\":\"x\"}"), Map.of("token", "AAAA"));

        assertThatThrownBy(() -> validator.validate("Slack", slack))
                .isInstanceOf(ReceiverValidationException.class)
                .hasMessageContaining("cannot decrypt secure setting token");
    }
}
