package com.github.dimitryivaniuta.essportal.gateway.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.dimitryivaniuta.essportal.common.error.ConfigurationException;
import com.github.dimitryivaniuta.essportal.common.error.ErrorKind;
import com.github.dimitryivaniuta.essportal.common.error.GatewayException;
import com.github.dimitryivaniuta.essportal.gateway.security.JwtProperties;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class JwtTokenServiceTest {

    static final String SECRET = "0123456789abcdef0123456789abcdef-portal";
    static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final JwtTokenService service = new JwtTokenService(props(SECRET, "HS256"), clock);

    static JwtProperties props(final String secret, final String alg) {
        return new JwtProperties(secret, alg, Duration.ofMinutes(30), Duration.ofDays(7), "ess-test");
    }

    private String access(final String subject, final Duration ttl) {
        return service.issueAccess(subject, Map.of(TokenService.CLAIM_ADMIN, true), ttl).block().token();
    }

    private static void assertUnauthorized(final Throwable e) {
        assertThat(e).isInstanceOf(GatewayException.class);
        assertThat(((GatewayException) e).getKind()).isEqualTo(ErrorKind.UNAUTHORIZED);
    }

    @Nested
    @DisplayName("expiry")
    class Expiry {

        @Test
        void validJustBeforeExpiry() {
            String token = access("alice@example.com", Duration.ofMinutes(30));
            clock.advance(Duration.ofMinutes(30).minusSeconds(1));

            StepVerifier.create(service.verifyAccess(token))
                    .assertNext(c -> {
                        assertThat(c.subject()).isEqualTo("alice@example.com");
                        assertThat(c.admin()).isTrue();
                        assertThat(c.type()).isEqualTo(TokenType.ACCESS);
                        assertThat(c.expiresAt()).isEqualTo(T0.plus(Duration.ofMinutes(30)));
                    })
                    .verifyComplete();
        }

        @Test
        void rejectedExactlyAtExpiry() {
            String token = access("alice@example.com", Duration.ofMinutes(30));
            clock.advance(Duration.ofMinutes(30));

            StepVerifier.create(service.verifyAccess(token))
                    .verifyErrorSatisfies(JwtTokenServiceTest::assertUnauthorized);
        }

        @Test
        void defaultTtlComesFromProperties() {
            MintedToken minted = service.issueAccess("alice@example.com", Map.of()).block();

            assertThat(minted.ttl()).isEqualTo(Duration.ofMinutes(30));
            assertThat(service.issueRefresh("alice@example.com", Map.of()).block().ttl()).isEqualTo(Duration.ofDays(7));
        }
    }

    @Nested
    @DisplayName("rejection")
    class Rejection {

        @Test
        void refreshTokenIsNotAnAccessToken() {
            String refresh = service.issueRefresh("alice@example.com", Map.of()).block().token();

            StepVerifier.create(service.verifyAccess(refresh))
                    .verifyErrorSatisfies(JwtTokenServiceTest::assertUnauthorized);
            StepVerifier.create(service.verifyRefresh(refresh))
                    .assertNext(c -> assertThat(c.type()).isEqualTo(TokenType.REFRESH))
                    .verifyComplete();
        }

        @Test
        void accessTokenIsNotARefreshToken() {
            StepVerifier.create(service.verifyRefresh(access("alice@example.com", null)))
                    .verifyErrorSatisfies(JwtTokenServiceTest::assertUnauthorized);
        }

        @Test
        void foreignSignatureRejected() {
            JwtTokenService other = new JwtTokenService(props("another-secret-another-secret-1234", "HS256"), clock);
            String foreign = other.issueAccess("alice@example.com", Map.of()).block().token();

            StepVerifier.create(service.verifyAccess(foreign))
                    .verifyErrorSatisfies(JwtTokenServiceTest::assertUnauthorized);
        }

        @Test
        void tamperedPayloadRejected() {
            String[] parts = access("alice@example.com", null).split("\\.");
            String forged = parts[0] + "." + parts[1].substring(0, parts[1].length() - 2) + "AA." + parts[2];

            StepVerifier.create(service.verifyAccess(forged))
                    .verifyErrorSatisfies(JwtTokenServiceTest::assertUnauthorized);
        }

        @Test
        void malformedRejectedWithoutEchoingToken() {
            StepVerifier.create(service.verifyAccess("not-a-jwt-value"))
                    .verifyErrorSatisfies(e -> {
                        assertUnauthorized(e);
                        assertThat(e.getMessage()).doesNotContain("not-a-jwt-value");
                    });
        }

        @Test
        void missingSubjectRejected() throws Exception {
            JWTClaimsSet claims = new JWTClaimsSet.Builder()
                    .issueTime(Date.from(T0))
                    .expirationTime(Date.from(T0.plusSeconds(600)))
                    .claim(TokenService.CLAIM_TOKEN_TYPE, "access")
                    .build();
            SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
            jwt.sign(new MACSigner(SECRET.getBytes(StandardCharsets.UTF_8)));

            StepVerifier.create(service.verifyAccess(jwt.serialize()))
                    .verifyErrorSatisfies(JwtTokenServiceTest::assertUnauthorized);
        }

        @Test
        void blankSubjectCannotBeIssued() {
            StepVerifier.create(service.issueAccess(" ", Map.of()))
                    .verifyErrorSatisfies(e -> assertThat(((GatewayException) e).getKind()).isEqualTo(ErrorKind.VALIDATION));
        }
    }

    @Test
    void callerCannotOverrideReservedClaims() {
        String token = service.issueAccess("alice@example.com",
                Map.of(TokenService.CLAIM_TOKEN_TYPE, "refresh", "sub", "mallory@example.com"), null).block().token();

        StepVerifier.create(service.verifyAccess(token))
                .assertNext(c -> assertThat(c.subject()).isEqualTo("alice@example.com"))
                .verifyComplete();
    }

    @Nested
    @DisplayName("configuration")
    class Configuration {

        @Test
        void shortSecretRefused() {
            assertThatThrownBy(() -> new JwtTokenService(props("too-short", "HS256"), clock))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        void hs512NeedsLongerSecret() {
            assertThatThrownBy(() -> new JwtTokenService(props(SECRET, "HS512"), clock))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("64 bytes");
        }

        @Test
        void asymmetricAlgorithmRefused() {
            assertThatThrownBy(() -> new JwtTokenService(props(SECRET, "RS256"), clock))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        void missingSecretRefused() {
            assertThatThrownBy(() -> new JwtTokenService(props(null, "HS256"), clock))
                    .isInstanceOf(ConfigurationException.class);
        }
    }
}
