package com.github.dimitryivaniuta.essportal.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.dimitryivaniuta.essportal.common.error.GatewayException;
import com.github.dimitryivaniuta.essportal.gateway.downstream.DownstreamDownload;
import com.github.dimitryivaniuta.essportal.gateway.downstream.HrBackendClient;
import com.github.dimitryivaniuta.essportal.gateway.downstream.UploadPart;
import com.github.dimitryivaniuta.essportal.gateway.model.UserEntity;
import com.github.dimitryivaniuta.essportal.gateway.tenant.DownstreamCredential;
import com.github.dimitryivaniuta.essportal.gateway.tenant.TenantCredentialStore;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.ConnectionTestResponse;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.LeaveRequest;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.UserProfileResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Portal operations proxied to the caller's tenant HR backend.
 *
 * <p>Each call resolves the tenant credential fresh; nothing decrypted outlives the call.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HrPortalService {

    static final String NOT_LINKED = "User not linked to HR system";
    static final String NO_UPCOMING_LEAVE = "No upcoming approved leave found.";
    static final String LEAVE_UNAVAILABLE = "Could not retrieve leave information.";
    static final String ATTENDANCE_UNAVAILABLE = "Could not retrieve attendance log.";

    private final TenantCredentialStore credentialStore;
    private final HrBackendClient client;
    private final ObjectMapper objectMapper;

    /** Local profile merged with the HR employee record; downstream trouble degrades to local data. */
    public Mono<UserProfileResponse> profile(final UserEntity user) {
        Mono<Optional<JsonNode>> hr = user.getHrEmployeeId() == null
                ? Mono.just(Optional.empty())
                : json(user, HttpMethod.GET, "/employee/" + user.getHrEmployeeId(), null)
                        .map(Optional::of)
                        .onErrorResume(GatewayException.class, e -> {
                            log.warn("HR profile of userId={} unavailable ({}); using local data",
                                    user.getId(), e.getKind());
                            return Mono.just(Optional.empty());
                        });
        return hr.map(node -> new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getFullName(),
                user.getTenantId(),
                user.getHrEmployeeId(),
                user.getJobTitle(),
                user.getPhone(),
                user.isAdmin(),
                node.orElse(null)));
    }

    public Mono<JsonNode> leaveTypes(final UserEntity user) {
        return json(user, HttpMethod.GET, "/leave-types", null);
    }

    /** Renames the portal fields to the backend contract and adds the employee id. */
    public Mono<JsonNode> submitLeave(final UserEntity user, final LeaveRequest request) {
        return withEmployee(user, employeeId -> {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("employee_id", employeeId);
            body.put("leave_type_id", request.leaveTypeId());
            body.put("from_date", request.fromDate().toString());
            body.put("to_date", request.toDate().toString());
            body.put("note", request.note());
            return json(user, HttpMethod.POST, "/leave", body);
        });
    }

    /** Dashboard counter; any downstream failure reads as zero. */
    public Mono<JsonNode> pendingLeavesCount(final UserEntity user) {
        return withEmployee(user, employeeId -> json(user, HttpMethod.GET, "/leaves/pending-count/" + employeeId, null)
                .onErrorResume(GatewayException.class, e -> {
                    log.warn("Pending leave count of employee={} unavailable ({}); returning 0", employeeId, e.getKind());
                    ObjectNode fallback = objectMapper.createObjectNode();
                    fallback.put("employee_id", employeeId);
                    fallback.put("pending_leave_count", 0);
                    return Mono.just(fallback);
                }));
    }

    /**
     * Next approved day off. An answer without {@code next_day_off} and any lookup failure
     * both become a message for the dashboard.
     */
    public Mono<JsonNode> nextDayOff(final UserEntity user) {
        return withEmployee(user, employeeId -> json(user, HttpMethod.GET, "/leaves/next-off/" + employeeId, null)
                .map(node -> node.hasNonNull("next_day_off") ? node : employeeMessage(employeeId, NO_UPCOMING_LEAVE))
                .onErrorResume(GatewayException.class, e -> {
                    log.warn("Next day off of employee={} unavailable ({})", employeeId, e.getKind());
                    return Mono.just(employeeMessage(employeeId, LEAVE_UNAVAILABLE));
                }));
    }

    public Mono<JsonNode> payslips(final UserEntity user) {
        if (user.getHrEmployeeId() == null) {
            return Mono.just(objectMapper.createArrayNode());
        }
        return json(user, HttpMethod.GET, "/payslips/" + user.getHrEmployeeId(), null);
    }

    public Mono<DownstreamDownload> downloadPayslip(final UserEntity user, final long payslipId) {
        return credential(user).flatMap(c -> client.download(c, path("/payslip/" + payslipId + "/download")));
    }

    public Mono<JsonNode> submitExpense(final UserEntity user, final String description, final String amount,
                                        final String date, final UploadPart receipt) {
        return withEmployee(user, employeeId -> {
            Map<String, String> fields = new LinkedHashMap<>();
            fields.put("employee_id", String.valueOf(employeeId));
            fields.put("description", description);
            fields.put("amount", amount);
            fields.put("date", date);
            return multipart(user, "/expenses", fields, List.of(receipt));
        });
    }

    public Mono<JsonNode> documents(final UserEntity user) {
        if (user.getHrEmployeeId() == null) {
            return Mono.just(objectMapper.createArrayNode());
        }
        return json(user, HttpMethod.GET, "/employee/" + user.getHrEmployeeId() + "/documents", null);
    }

    public Mono<JsonNode> uploadDocument(final UserEntity user, final String documentType, final UploadPart file) {
        return withEmployee(user, employeeId -> multipart(user, "/employee/" + employeeId + "/document",
                Map.of("document_type", documentType), List.of(file)));
    }

    /** Relays the backend's confirmation, or a generic one when it sends none. */
    public Mono<JsonNode> deleteDocument(final UserEntity user, final long attachmentId) {
        return json(user, HttpMethod.DELETE, "/attachment/" + attachmentId, null)
                .map(node -> {
                    ObjectNode result = objectMapper.createObjectNode();
                    result.put("message", node.hasNonNull("message")
                            ? node.get("message").asText()
                            : "Document deletion processed by HR system.");
                    return result;
                });
    }

    public Mono<DownstreamDownload> downloadDocument(final UserEntity user, final long attachmentId) {
        return credential(user).flatMap(c -> client.download(c, path("/attachment/" + attachmentId + "/download")));
    }

    public Mono<JsonNode> attendanceStatus(final UserEntity user) {
        return withEmployee(user, employeeId -> json(user, HttpMethod.GET, "/attendance/status/" + employeeId, null));
    }

    /** Today's attendance entries. Unlinked users get a message instead of an error. */
    public Mono<JsonNode> todayAttendanceLog(final UserEntity user) {
        Long employeeId = user.getHrEmployeeId();
        if (employeeId == null) {
            ObjectNode node = objectMapper.createObjectNode();
            node.put("message", "Not linked to HR system.");
            return Mono.just(node);
        }
        return json(user, HttpMethod.GET, "/attendance/today-log/" + employeeId, null)
                .<JsonNode>map(entries -> {
                    ObjectNode node = objectMapper.createObjectNode();
                    node.put("employee_id", employeeId);
                    node.set("attendance_log", entries);
                    return node;
                })
                .onErrorResume(HrPortalService::degradesAttendanceLog, e -> {
                    log.warn("Attendance log of employee={} unavailable ({})", employeeId, e.getMessage());
                    return Mono.just(employeeMessage(employeeId, ATTENDANCE_UNAVAILABLE));
                });
    }

    public Mono<JsonNode> checkIn(final UserEntity user) {
        return withEmployee(user, employeeId -> multipart(user, "/attendance/check-in",
                Map.of("employee_id", String.valueOf(employeeId)), List.of()));
    }

    public Mono<JsonNode> checkOut(final UserEntity user) {
        return withEmployee(user, employeeId -> multipart(user, "/attendance/check-out",
                Map.of("employee_id", String.valueOf(employeeId)), List.of()));
    }

    /**
     * Checks a tenant's backend with its stored credential. Never fails: every problem is
     * reported in the result.
     */
    public Mono<ConnectionTestResponse> testConnection(final Long tenantId) {
        return credentialStore.resolve(tenantId)
                .flatMap(c -> client.exchange(c, HttpMethod.GET, path("/auth-test"), null))
                .map(ConnectionTestResponse::success)
                .doOnNext(r -> log.info("HR connection test for tenant={} succeeded", tenantId))
                .onErrorResume(GatewayException.class, e -> {
                    log.warn("HR connection test for tenant={} failed: {} {}", tenantId, e.getKind(), e.getMessage());
                    return Mono.just(ConnectionTestResponse.failure(e.getMessage()));
                });
    }

    /**
     * Searches the tenant's HR employees so an administrator can link a portal user.
     *
     * @param term optional name fragment
     */
    public Mono<JsonNode> searchEmployees(final Long tenantId, final String term, final int limit) {
        Map<String, Object> query = new LinkedHashMap<>();
        if (term != null && !term.isBlank()) {
            query.put("term", term.trim());
        }
        query.put("limit", limit);
        return credentialStore.resolve(tenantId)
                .flatMap(c -> client.exchange(c, HttpMethod.GET, path("/admin/employees/search"), query, null));
    }

    private Mono<JsonNode> withEmployee(final UserEntity user, final Function<Long, Mono<JsonNode>> call) {
        if (user.getHrEmployeeId() == null) {
            return Mono.error(GatewayException.validation(NOT_LINKED));
        }
        return call.apply(user.getHrEmployeeId());
    }

    private JsonNode employeeMessage(final Long employeeId, final String message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("employee_id", employeeId);
        node.put("message", message);
        return node;
    }

    // Client mistakes other than 403/404 still reach the caller
    private static boolean degradesAttendanceLog(final Throwable e) {
        if (!(e instanceof GatewayException ge)) {
            return false;
        }
        int status = ge.getStatus();
        return status == 403 || status == 404 || status >= 500;
    }

    private Mono<JsonNode> json(final UserEntity user, final HttpMethod method, final String path, final Object body) {
        return credential(user).flatMap(c -> client.exchange(c, method, path(path), body));
    }

    private Mono<JsonNode> multipart(final UserEntity user, final String path,
                                     final Map<String, String> fields, final List<UploadPart> files) {
        return credential(user).flatMap(c -> client.postMultipart(c, path(path), fields, files));
    }

    private Mono<DownstreamCredential> credential(final UserEntity user) {
        return credentialStore.resolve(user.getTenantId());
    }

    private String path(final String relative) {
        return client.apiPrefix() + relative;
    }
}
