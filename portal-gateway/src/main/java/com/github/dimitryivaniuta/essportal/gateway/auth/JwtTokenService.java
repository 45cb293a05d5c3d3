package com.github.dimitryivaniuta.essportal.gateway.auth;

import com.github.dimitryivaniuta.essportal.common.error.ConfigurationException;
import com.github.dimitryivaniuta.essportal.common.error.GatewayException;
import com.github.dimitryivaniuta.essportal.gateway.security.JwtProperties;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimNames;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Issues and verifies HS256/384/512 signed JWTs with a shared secret.
 *
 * Claims included:
 * - sub, iat, exp, jti (iss when configured)
 * - token_type (access | refresh)
 * - caller supplied claims such as is_admin
 *
 * A token is expired once the clock reaches {@code exp}; there is no leeway.
 */
@Slf4j
@Service
public class JwtTokenService implements TokenService {

    private static final Set<String> RESERVED = Set.of(
            JWTClaimNames.SUBJECT, JWTClaimNames.ISSUED_AT, JWTClaimNames.EXPIRATION_TIME,
            JWTClaimNames.JWT_ID, JWTClaimNames.ISSUER, CLAIM_TOKEN_TYPE);

    private final JwtProperties jwtProperties;
    private final Clock clock;
    private final JWSAlgorithm algorithm;
    private final JWSSigner signer;
    private final JWSVerifier verifier;

    public JwtTokenService(final JwtProperties jwtProperties, final Clock clock) {
        this.jwtProperties = jwtProperties;
        this.clock = clock;
        this.algorithm = resolveAlgorithm(jwtProperties.algorithm());
        byte[] secret = requireSecret(jwtProperties.secret(), algorithm);
        try {
            this.signer = new MACSigner(secret);
            this.verifier = new MACVerifier(secret);
        } catch (JOSEException e) {
            throw new ConfigurationException("Unusable security.jwt.secret", e);
        }
        log.info("Token service ready alg={} accessTtl={} refreshTtl={}",
                algorithm, jwtProperties.accessTokenTtl(), jwtProperties.refreshTokenTtl());
    }

    @Override
    public Mono<MintedToken> issueAccess(final String subject, final Map<String, Object> claims, final Duration ttl) {
        return issue(subject, claims, orDefault(ttl, jwtProperties.accessTokenTtl(), Duration.ofMinutes(30)), TokenType.ACCESS);
    }

    @Override
    public Mono<MintedToken> issueRefresh(final String subject, final Map<String, Object> claims, final Duration ttl) {
        return issue(subject, claims, orDefault(ttl, jwtProperties.refreshTokenTtl(), Duration.ofDays(7)), TokenType.REFRESH);
    }

    @Override
    public Mono<TokenClaims> verifyAccess(final String token) {
        return Mono.fromCallable(() -> verify(token, TokenType.ACCESS));
    }

    @Override
    public Mono<TokenClaims> verifyRefresh(final String token) {
        return Mono.fromCallable(() -> verify(token, TokenType.REFRESH));
    }

    private Mono<MintedToken> issue(final String subject, final Map<String, Object> claims,
                                    final Duration ttl, final TokenType type) {
        return Mono.fromCallable(() -> {
            if (subject == null || subject.isBlank()) {
                throw GatewayException.validation("Token subject must not be blank");
            }
            Instant now = clock.instant();
            Instant exp = now.plus(ttl);

            var builder = new JWTClaimsSet.Builder()
                    .subject(subject)
                    .issueTime(Date.from(now))
                    .expirationTime(Date.from(exp))
                    .jwtID(UUID.randomUUID().toString());
            if (jwtProperties.issuer() != null && !jwtProperties.issuer().isBlank()) {
                builder.issuer(jwtProperties.issuer());
            }
            if (claims != null) {
                claims.forEach((name, value) -> {
                    if (!RESERVED.contains(name)) {
                        builder.claim(name, value);
                    }
                });
            }
            builder.claim(CLAIM_TOKEN_TYPE, type.claimValue());

            var jwt = new SignedJWT(new JWSHeader.Builder(algorithm).type(JOSEObjectType.JWT).build(), builder.build());
            jwt.sign(signer);

            if (log.isDebugEnabled()) {
                log.debug("Minted {} token sub={} exp={}", type.claimValue(), subject, exp);
            }
            return new MintedToken(jwt.serialize(), ttl, exp);
        });
    }

    private TokenClaims verify(final String token, final TokenType expected) {
        if (token == null || token.isBlank()) {
            throw GatewayException.unauthorized("Missing token");
        }
        try {
            SignedJWT jwt = SignedJWT.parse(token);
            if (!algorithm.equals(jwt.getHeader().getAlgorithm())) {
                throw GatewayException.unauthorized("Unexpected token algorithm");
            }
            if (!jwt.verify(verifier)) {
                throw GatewayException.unauthorized("Invalid token signature");
            }
            JWTClaimsSet set = jwt.getJWTClaimsSet();

            Date exp = set.getExpirationTime();
            if (exp == null || !clock.instant().isBefore(exp.toInstant())) {
                throw GatewayException.unauthorized("Token expired");
            }
            String subject = set.getSubject();
            if (subject == null || subject.isBlank()) {
                throw GatewayException.unauthorized("Token has no subject");
            }
            String type = set.getStringClaim(CLAIM_TOKEN_TYPE);
            if (!expected.claimValue().equals(type)) {
                throw GatewayException.unauthorized("Wrong token type");
            }

            Map<String, Object> custom = new LinkedHashMap<>(set.getClaims());
            custom.keySet().removeAll(Set.of(JWTClaimNames.SUBJECT, JWTClaimNames.ISSUED_AT,
                    JWTClaimNames.EXPIRATION_TIME, JWTClaimNames.NOT_BEFORE, JWTClaimNames.AUDIENCE));
            Date iat = set.getIssueTime();
            return new TokenClaims(
                    subject,
                    Boolean.TRUE.equals(set.getBooleanClaim(CLAIM_ADMIN)),
                    expected,
                    iat == null ? null : iat.toInstant(),
                    exp.toInstant(),
                    Map.copyOf(custom));
        } catch (ParseException e) {
            throw GatewayException.unauthorized("Malformed token");
        } catch (JOSEException e) {
            throw GatewayException.unauthorized("Token verification failed");
        }
    }

    private static Duration orDefault(final Duration requested, final Duration configured, final Duration fallback) {
        if (requested != null && !requested.isNegative() && !requested.isZero()) {
            return requested;
        }
        if (configured != null && !configured.isNegative() && !configured.isZero()) {
            return configured;
        }
        return fallback;
    }

    private static JWSAlgorithm resolveAlgorithm(final String name) {
        JWSAlgorithm alg = JWSAlgorithm.parse(name == null || name.isBlank() ? "HS256" : name.trim().toUpperCase());
        if (!JWSAlgorithm.Family.HMAC_SHA.contains(alg)) {
            throw new ConfigurationException("Unsupported security.jwt.algorithm: " + name);
        }
        return alg;
    }

    private static byte[] requireSecret(final String secret, final JWSAlgorithm alg) {
        if (secret == null || secret.isBlank()) {
            throw new ConfigurationException("security.jwt.secret is not configured");
        }
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        int required = JWSAlgorithm.HS512.equals(alg) ? 64 : JWSAlgorithm.HS384.equals(alg) ? 48 : 32;
        if (bytes.length < required) {
            throw new ConfigurationException(
                    "security.jwt.secret must be at least " + required + " bytes for " + alg);
        }
        return bytes;
    }
}
