package com.github.dimitryivaniuta.essportal.gateway.vault;

import com.github.dimitryivaniuta.essportal.common.error.ConfigurationException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Symmetric authenticated encryption for downstream API keys at rest.
 *
 * <p>AES-256-GCM with a random 12-byte IV per call. The stored form is
 * {@code Base64(iv || ciphertext || tag)}, so encrypting the same value twice yields
 * different ciphertexts. Decryption never throws: a tampered, truncated or foreign
 * ciphertext yields {@link Optional#empty()}.</p>
 *
 * <p>A missing or malformed key is a startup failure, not a per-request one.</p>
 */
@Slf4j
@Component
public class CredentialVault {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_BYTES = 32;
    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final SecretKey key;
    private final SecureRandom random = new SecureRandom();

    public CredentialVault(final VaultProperties properties) {
        this.key = decodeKey(properties == null ? null : properties.key());
        log.info("Credential vault initialised (AES-256-GCM)");
    }

    /**
     * Encrypts a plaintext secret.
     *
     * @param plaintext secret to protect, never null
     * @return Base64 text safe to store in a VARCHAR/TEXT column
     */
    public String encrypt(final String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        try {
            byte[] iv = new byte[IV_BYTES];
            random.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(
                    ByteBuffer.allocate(iv.length + sealed.length).put(iv).put(sealed).array());
        } catch (GeneralSecurityException e) {
            throw new ConfigurationException("Credential encryption failed", e);
        }
    }

    /**
     * Decrypts a value produced by {@link #encrypt(String)} with the same key.
     *
     * @param ciphertext stored Base64 text
     * @return plaintext, or empty when the input is not a valid ciphertext under this key
     */
    public Optional<String> decrypt(final String ciphertext) {
        if (ciphertext == null || ciphertext.isBlank()) {
            return Optional.empty();
        }
        try {
            byte[] raw = Base64.getDecoder().decode(ciphertext.trim());
            if (raw.length < IV_BYTES + TAG_BITS / 8) {
                log.warn("Rejected ciphertext: too short ({} bytes)", raw.length);
                return Optional.empty();
            }
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, raw, 0, IV_BYTES));
            byte[] plain = cipher.doFinal(raw, IV_BYTES, raw.length - IV_BYTES);
            return Optional.of(new String(plain, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            log.warn("Rejected ciphertext: {}", e.getClass().getSimpleName());
            return Optional.empty();
        }
    }

    private static SecretKey decodeKey(final String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new ConfigurationException("security.vault.key is not configured");
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("security.vault.key is not valid Base64", e);
        }
        if (bytes.length != KEY_BYTES) {
            throw new ConfigurationException(
                    "security.vault.key must decode to " + KEY_BYTES + " bytes, got " + bytes.length);
        }
        return new SecretKeySpec(bytes, "AES");
    }
}
