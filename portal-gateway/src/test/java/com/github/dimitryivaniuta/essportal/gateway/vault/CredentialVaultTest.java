package com.github.dimitryivaniuta.essportal.gateway.vault;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.dimitryivaniuta.essportal.common.error.ConfigurationException;
import java.util.Base64;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CredentialVaultTest {

    static final String KEY = Base64.getEncoder().encodeToString(new byte[] {
            1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16,
            17, 18, 19, 20, 21, 22, 23, 24, 25, 26, 27, 28, 29, 30, 31, 32});
    static final String OTHER_KEY = Base64.getEncoder().encodeToString(new byte[32]);

    private final CredentialVault vault = new CredentialVault(new VaultProperties(KEY));

    @Nested
    @DisplayName("round trip")
    class RoundTrip {

        @Test
        void decryptsWhatItEncrypted() {
            String ciphertext = vault.encrypt("hr-api-key-123");

            assertThat(ciphertext).doesNotContain("hr-api-key-123");
            assertThat(vault.decrypt(ciphertext)).contains("hr-api-key-123");
        }

        @Test
        void sameInputGivesDifferentCiphertexts() {
            assertThat(vault.encrypt("k")).isNotEqualTo(vault.encrypt("k"));
        }

        @Test
        void handlesEmptyAndUnicode() {
            assertThat(vault.decrypt(vault.encrypt(""))).contains("");
            assertThat(vault.decrypt(vault.encrypt("ключ-🔑"))).contains("ключ-🔑");
        }
    }

    @Nested
    @DisplayName("rejected input")
    class Rejected {

        @Test
        void tamperedCiphertextIsEmpty() {
            byte[] raw = Base64.getDecoder().decode(vault.encrypt("secret"));
            raw[raw.length - 1] ^= 0x01;

            assertThat(vault.decrypt(Base64.getEncoder().encodeToString(raw))).isEmpty();
        }

        @Test
        void foreignKeyIsEmpty() {
            String foreign = new CredentialVault(new VaultProperties(OTHER_KEY)).encrypt("secret");

            assertThat(vault.decrypt(foreign)).isEmpty();
        }

        @Test
        void garbageIsEmpty() {
            assertThat(vault.decrypt("not base64 at all!")).isEmpty();
            assertThat(vault.decrypt("AAAA")).isEmpty();
            assertThat(vault.decrypt("")).isEmpty();
            assertThat(vault.decrypt(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("key material")
    class KeyMaterial {

        @Test
        void missingKeyFailsAtConstruction() {
            assertThatThrownBy(() -> new CredentialVault(new VaultProperties("")))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> new CredentialVault(new VaultProperties(null)))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        void wrongLengthKeyFailsAtConstruction() {
            String shortKey = Base64.getEncoder().encodeToString(new byte[16]);

            assertThatThrownBy(() -> new CredentialVault(new VaultProperties(shortKey)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("32 bytes");
        }

        @Test
        void nonBase64KeyFailsAtConstruction() {
            assertThatThrownBy(() -> new CredentialVault(new VaultProperties("%%%")))
                    .isInstanceOf(ConfigurationException.class);
        }
    }
}
