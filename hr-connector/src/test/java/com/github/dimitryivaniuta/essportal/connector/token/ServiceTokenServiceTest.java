package com.github.dimitryivaniuta.essportal.connector.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.github.dimitryivaniuta.essportal.common.error.ErrorKind;
import com.github.dimitryivaniuta.essportal.common.error.GatewayException;
import com.github.dimitryivaniuta.essportal.connector.MutableClock;
import com.github.dimitryivaniuta.essportal.connector.model.ConnectorAccountEntity;
import com.github.dimitryivaniuta.essportal.connector.model.ConnectorAccountRepository;
import com.github.dimitryivaniuta.essportal.connector.model.ServiceTokenEntity;
import com.github.dimitryivaniuta.essportal.connector.model.ServiceTokenRepository;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
class ServiceTokenServiceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ServiceTokenRepository tokenRepository;

    @Mock
    private ConnectorAccountRepository accountRepository;

    private ServiceTokenService service;

    @BeforeEach
    void setUp() {
        service = new ServiceTokenService(tokenRepository, accountRepository, new MutableClock(T0));
    }

    private static ConnectorAccountEntity account(final boolean active) {
        return ConnectorAccountEntity.builder().id(3L).login("portal-bot").displayName("Portal Bot").active(active).build();
    }

    private static ServiceTokenEntity token(final String value) {
        return ServiceTokenEntity.builder().id(11L).label("portal").accountId(3L).token(value)
                .scope(TokenScope.parse("hr.leave")).active(true).build();
    }

    @Test
    void createGeneratesUrlSafeValueAndParsesScope() {
        when(accountRepository.findById(3L)).thenReturn(Mono.just(account(true)));
        when(tokenRepository.save(any())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        StepVerifier.create(service.create(" portal ", 3L, "hr.leave,hr.leave.type", "backend"))
                .assertNext(t -> {
                    assertThat(t.getLabel()).isEqualTo("portal");
                    assertThat(t.getToken()).hasSize(43).matches("[A-Za-z0-9_-]+");
                    assertThat(t.getScope().kinds()).containsExactlyInAnyOrder(ResourceKind.LEAVE, ResourceKind.LEAVE_TYPE);
                    assertThat(t.isActive()).isTrue();
                    assertThat(t.getCreatedAt()).isEqualTo(OffsetDateTime.ofInstant(T0, ZoneOffset.UTC));
                })
                .verifyComplete();
    }

    @Test
    void createRejectsUnknownScopeBeforeTouchingStorage() {
        StepVerifier.create(service.create("portal", 3L, "hr.bonus", null))
                .expectErrorSatisfies(e -> assertThat(((GatewayException) e).getKind()).isEqualTo(ErrorKind.VALIDATION))
                .verify();

        verifyNoInteractions(accountRepository, tokenRepository);
    }

    @Test
    void createForMissingAccountIsNotFound() {
        when(accountRepository.findById(99L)).thenReturn(Mono.empty());

        StepVerifier.create(service.create("portal", 99L, null, null))
                .expectErrorSatisfies(e -> assertThat(((GatewayException) e).getKind()).isEqualTo(ErrorKind.NOT_FOUND))
                .verify();
        verify(tokenRepository, never()).save(any());
    }

    @Test
    void regenerateReplacesValueOnSameRecord() {
        when(tokenRepository.findById(11L)).thenReturn(Mono.just(token("old-value")));
        when(tokenRepository.save(any())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        StepVerifier.create(service.regenerate(11L))
                .assertNext(t -> {
                    assertThat(t.getId()).isEqualTo(11L);
                    assertThat(t.getToken()).isNotEqualTo("old-value").hasSize(43);
                })
                .verifyComplete();
    }

    @Test
    void toggleFlipsActiveFlag() {
        when(tokenRepository.findById(11L)).thenReturn(Mono.just(token("v")));
        when(tokenRepository.save(any())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        StepVerifier.create(service.toggle(11L))
                .assertNext(t -> assertThat(t.isActive()).isFalse())
                .verifyComplete();
    }

    @Test
    void validateResolvesAccountAndTouchesLastUsed() {
        when(tokenRepository.findByTokenAndActiveTrue("good")).thenReturn(Mono.just(token("good")));
        when(accountRepository.findById(3L)).thenReturn(Mono.just(account(true)));
        when(tokenRepository.touchLastUsed(eq(11L), any())).thenReturn(Mono.just(1));

        StepVerifier.create(service.validate("good"))
                .assertNext(caller -> {
                    assertThat(caller.account().getLogin()).isEqualTo("portal-bot");
                    assertThat(caller.token().getLastUsedAt()).isEqualTo(OffsetDateTime.ofInstant(T0, ZoneOffset.UTC));
                    assertThat(caller.scope().permits(ResourceKind.LEAVE)).isTrue();
                })
                .verifyComplete();
    }

    @Test
    void validateSurvivesLastUsedFailure() {
        when(tokenRepository.findByTokenAndActiveTrue("good")).thenReturn(Mono.just(token("good")));
        when(accountRepository.findById(3L)).thenReturn(Mono.just(account(true)));
        when(tokenRepository.touchLastUsed(eq(11L), any())).thenReturn(Mono.error(new IllegalStateException("db down")));

        StepVerifier.create(service.validate("good"))
                .expectNextCount(1)
                .verifyComplete();
    }

    @Test
    void validateIsEmptyForUnknownTokenOrInactiveAccount() {
        when(tokenRepository.findByTokenAndActiveTrue("nope")).thenReturn(Mono.empty());
        StepVerifier.create(service.validate("nope")).verifyComplete();

        when(tokenRepository.findByTokenAndActiveTrue("good")).thenReturn(Mono.just(token("good")));
        when(accountRepository.findById(3L)).thenReturn(Mono.just(account(false)));
        StepVerifier.create(service.validate("good")).verifyComplete();

        verify(tokenRepository, never()).touchLastUsed(anyLong(), any());
    }
}
