package com.github.dimitryivaniuta.essportal.gateway.web;

import com.github.dimitryivaniuta.essportal.gateway.model.TenantEntity;
import com.github.dimitryivaniuta.essportal.gateway.model.UserEntity;
import com.github.dimitryivaniuta.essportal.gateway.service.HrPortalService;
import com.github.dimitryivaniuta.essportal.gateway.service.TenantAdminService;
import com.github.dimitryivaniuta.essportal.gateway.service.UserAdminService;
import com.github.dimitryivaniuta.essportal.gateway.tenant.CredentialUpdate;
import com.github.dimitryivaniuta.essportal.gateway.tenant.CredentialView;
import com.github.dimitryivaniuta.essportal.gateway.tenant.TenantCredentialStore;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.AdminUserCreateRequest;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.AdminUserUpdateRequest;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.ConnectionTestResponse;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.HrConfigRequest;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.HrConfigResponse;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.TenantRequest;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.TenantResponse;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.TenantStatusRequest;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.UserResponse;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Tenant, HR connection and user administration. Route access requires {@code ROLE_ADMIN}
 * (see {@link com.github.dimitryivaniuta.essportal.gateway.config.SecurityConfig}).
 */
@Slf4j
@Validated
@RestController
@RequestMapping(path = "/api/v1/admin", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class AdminController {

    private final TenantCredentialStore credentialStore;

    private final HrPortalService portalService;

    private final TenantAdminService tenantAdminService;

    private final UserAdminService userAdminService;

    @GetMapping("/tenants")
    public Flux<TenantResponse> tenants() {
        return tenantAdminService.list().map(AdminController::toResponse);
    }

    @ResponseStatus(HttpStatus.CREATED)
    @PostMapping(path = "/tenants", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TenantResponse> createTenant(@Valid @RequestBody final TenantRequest req) {
        return tenantAdminService.create(req.name(), req.active()).map(AdminController::toResponse);
    }

    @GetMapping("/tenant/{id}")
    public Mono<TenantResponse> tenant(@PathVariable("id") final Long id) {
        return tenantAdminService.get(id).map(AdminController::toResponse);
    }

    @PutMapping(path = "/tenant/{id}/status", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TenantResponse> tenantStatus(@PathVariable("id") final Long id,
                                             @Valid @RequestBody final TenantStatusRequest req) {
        return tenantAdminService.updateStatus(id, req.active()).map(AdminController::toResponse);
    }

    @ResponseStatus(HttpStatus.NO_CONTENT)
    @DeleteMapping("/tenant/{id}")
    public Mono<Void> deleteTenant(@PathVariable("id") final Long id) {
        return tenantAdminService.delete(id);
    }

    @GetMapping("/tenant/{id}/hr-config")
    public Mono<HrConfigResponse> hrConfig(@PathVariable("id") final Long id) {
        return credentialStore.view(id).map(AdminController::toResponse);
    }

    @PutMapping(path = "/tenant/{id}/hr-config", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<HrConfigResponse> updateHrConfig(@PathVariable("id") final Long id,
                                                 @Valid @RequestBody final HrConfigRequest req) {
        return credentialStore.upsert(id, new CredentialUpdate(req.baseUrl(), req.dbName(), req.accountLogin(), req.apiKey()))
                .then(credentialStore.view(id))
                .map(AdminController::toResponse);
    }

    @PostMapping("/tenant/{id}/test-hr-connection")
    public Mono<ConnectionTestResponse> testHrConnection(@PathVariable("id") final Long id) {
        return tenantAdminService.get(id).then(portalService.testConnection(id));
    }

    /** HR employees of a tenant, for linking portal users. */
    @GetMapping("/hr-employees/search")
    public Mono<JsonNode> searchHrEmployees(@RequestParam("tenant_id") final Long tenantId,
                                            @RequestParam(name = "term", required = false) final String term,
                                            @RequestParam(name = "limit", defaultValue = "10")
                                            @Min(1) @Max(100) final int limit) {
        return tenantAdminService.get(tenantId).then(portalService.searchEmployees(tenantId, term, limit));
    }

    @GetMapping("/users")
    public Flux<UserResponse> users() {
        return userAdminService.list().map(AdminController::toResponse);
    }

    @ResponseStatus(HttpStatus.CREATED)
    @PostMapping(path = "/users", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<UserResponse> createUser(@Valid @RequestBody final AdminUserCreateRequest req) {
        return userAdminService.create(req).map(AdminController::toResponse);
    }

    @GetMapping("/user/{id}")
    public Mono<UserResponse> user(@PathVariable("id") final Long id) {
        return userAdminService.get(id).map(AdminController::toResponse);
    }

    @ResponseStatus(HttpStatus.NO_CONTENT)
    @DeleteMapping("/user/{id}")
    public Mono<Void> deleteUser(@AuthenticationPrincipal final Jwt jwt, @PathVariable("id") final Long id) {
        return userAdminService.delete(id, jwt.getSubject());
    }

    @PutMapping(path = "/user/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<UserResponse> updateUser(@PathVariable("id") final Long id,
                                         @Valid @RequestBody final AdminUserUpdateRequest req) {
        return userAdminService.update(id, req).map(AdminController::toResponse);
    }

    // ---------- helpers ----------

    private static TenantResponse toResponse(final TenantEntity t) {
        return new TenantResponse(t.getId(), t.getName(), t.isActive(), t.getCreatedAt());
    }

    private static HrConfigResponse toResponse(final CredentialView v) {
        return new HrConfigResponse(v.tenantId(), v.baseUrl(), v.dbName(), v.accountLogin(),
                v.apiKeyConfigured(), v.updatedAt());
    }

    private static UserResponse toResponse(final UserEntity u) {
        return new UserResponse(u.getId(), u.getEmail(), u.getFullName(), u.getTenantId(),
                u.getHrEmployeeId(), u.getJobTitle(), u.getPhone(), u.isAdmin(), u.isActive(), u.getCreatedAt());
    }
}
