package com.github.dimitryivaniuta.essportal.connector.web;

import com.github.dimitryivaniuta.essportal.connector.token.ServiceTokenService;
import com.github.dimitryivaniuta.essportal.connector.web.dto.ServiceTokenCreateRequest;
import com.github.dimitryivaniuta.essportal.connector.web.dto.ServiceTokenResponse;
import com.github.dimitryivaniuta.essportal.connector.web.dto.ServiceTokenStatusRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Service-token administration, behind HTTP Basic.
 */
@RestController
@RequestMapping("/admin/service-tokens")
@RequiredArgsConstructor
public class ServiceTokenAdminController {

    private final ServiceTokenService tokenService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ServiceTokenResponse> create(@Valid @RequestBody final ServiceTokenCreateRequest req) {
        return tokenService.create(req.label(), req.accountId(), req.scope(), req.note())
                .map(ServiceTokenResponse::revealed);
    }

    @GetMapping
    public Flux<ServiceTokenResponse> list() {
        return tokenService.list().map(ServiceTokenResponse::masked);
    }

    @PostMapping("/{id}/regenerate")
    public Mono<ServiceTokenResponse> regenerate(@PathVariable final Long id) {
        return tokenService.regenerate(id).map(ServiceTokenResponse::revealed);
    }

    @PutMapping("/{id}/status")
    public Mono<ServiceTokenResponse> setStatus(@PathVariable final Long id,
                                                @Valid @RequestBody final ServiceTokenStatusRequest req) {
        return tokenService.setActive(id, req.active()).map(ServiceTokenResponse::masked);
    }

    @PostMapping("/{id}/toggle")
    public Mono<ServiceTokenResponse> toggle(@PathVariable final Long id) {
        return tokenService.toggle(id).map(ServiceTokenResponse::masked);
    }
}
