package com.alertmigrator.service.core.secrets;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Encrypts secure settings before they are persisted. No key scope is applied: every secret is encrypted with the
 * service's default key.
 */
public interface SecretsService {

    byte[] encrypt(byte[] plaintext);

    byte[] decrypt(byte[] ciphertext);

    default String encryptToBase64(String plaintext) {
        return Base64.getEncoder().encodeToString(encrypt(plaintext.getBytes(StandardCharsets.UTF_8)));
    }

    default String decryptFromBase64(String encoded) {
        byte[] ciphertext;
        try {
            ciphertext = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException ex) {
            throw new SecretsException("secure value is not valid base64", ex);
        }
        return new String(decrypt(ciphertext), StandardCharsets.UTF_8);
    }
}
