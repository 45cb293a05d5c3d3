package com.github.dimitryivaniuta.essportal.gateway.web;

import com.github.dimitryivaniuta.essportal.gateway.auth.AuthService;
import com.github.dimitryivaniuta.essportal.gateway.auth.PasswordResetService;
import com.github.dimitryivaniuta.essportal.gateway.auth.TokenPair;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.LoginRequest;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.MessageResponse;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.PasswordResetConfirmRequest;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.PasswordResetRequest;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.RefreshRequest;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.TokenResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Reactive authentication controller:
 * <ol>
 *   <li>password login returning an access/refresh pair,</li>
 *   <li>refresh-token exchange,</li>
 *   <li>password reset request and confirmation.</li>
 * </ol>
 * All endpoints are public.
 */
@Slf4j
@Validated
@RestController
@RequestMapping(path = "/api/v1", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    private final PasswordResetService passwordResetService;

    @PostMapping(path = "/login", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TokenResponse> login(@Valid @RequestBody final LoginRequest req) {
        return authService.login(req.email().trim(), req.password()).map(AuthController::toResponse);
    }

    @PostMapping(path = "/auth/refresh-token", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TokenResponse> refresh(@Valid @RequestBody final RefreshRequest req) {
        return authService.refresh(req.refreshToken()).map(AuthController::toResponse);
    }

    @PostMapping(path = "/auth/request-password-reset", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<MessageResponse> requestPasswordReset(@Valid @RequestBody final PasswordResetRequest req) {
        return passwordResetService.requestReset(req.email().trim()).map(MessageResponse::new);
    }

    @PostMapping(path = "/auth/reset-password", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<MessageResponse> resetPassword(@Valid @RequestBody final PasswordResetConfirmRequest req) {
        return passwordResetService.resetPassword(req.token(), req.newPassword()).map(MessageResponse::new);
    }

    private static TokenResponse toResponse(final TokenPair pair) {
        return TokenResponse.bearer(
                pair.access().token(),
                pair.refresh().token(),
                pair.access().ttl().toSeconds());
    }
}
