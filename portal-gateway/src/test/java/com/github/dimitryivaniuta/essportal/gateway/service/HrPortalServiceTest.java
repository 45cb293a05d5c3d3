package com.github.dimitryivaniuta.essportal.gateway.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.essportal.common.error.ErrorKind;
import com.github.dimitryivaniuta.essportal.common.error.GatewayException;
import com.github.dimitryivaniuta.essportal.gateway.auth.MutableClock;
import com.github.dimitryivaniuta.essportal.gateway.downstream.DownstreamProperties;
import com.github.dimitryivaniuta.essportal.gateway.downstream.HrBackendClient;
import com.github.dimitryivaniuta.essportal.gateway.downstream.UploadPart;
import com.github.dimitryivaniuta.essportal.gateway.model.TenantCredentialEntity;
import com.github.dimitryivaniuta.essportal.gateway.model.TenantCredentialRepository;
import com.github.dimitryivaniuta.essportal.gateway.model.TenantRepository;
import com.github.dimitryivaniuta.essportal.gateway.model.UserEntity;
import com.github.dimitryivaniuta.essportal.gateway.tenant.TenantCredentialStore;
import com.github.dimitryivaniuta.essportal.gateway.vault.CredentialVault;
import com.github.dimitryivaniuta.essportal.gateway.vault.VaultProperties;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.LeaveRequest;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.netty.http.server.HttpServerRoutes;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
class HrPortalServiceTest {

    private static final long TENANT = 1L;

    @Mock
    private TenantRepository tenantRepository;

    @Mock
    private TenantCredentialRepository credentialRepository;

    private final ObjectMapper mapper = new ObjectMapper();
    private CredentialVault vault;
    private HrPortalService service;
    private DisposableServer server;

    @BeforeEach
    void setUp() {
        vault = new CredentialVault(new VaultProperties(Base64.getEncoder().encodeToString(new byte[32])));
        TenantCredentialStore store = new TenantCredentialStore(tenantRepository, credentialRepository, vault,
                new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
        HrBackendClient client = new HrBackendClient(WebClient.builder(),
                new DownstreamProperties(Duration.ofSeconds(2), Duration.ofSeconds(1), "/ess/api"), mapper);
        service = new HrPortalService(store, client, mapper);
    }

    @AfterEach
    void stop() {
        if (server != null) {
            server.disposeNow();
        }
    }

    private void backend(final Consumer<? super HttpServerRoutes> routes) {
        server = HttpServer.create().host("127.0.0.1").port(0).route(routes).bindNow();
        configure("http://127.0.0.1:" + server.port() + "/db");
    }

    private void configure(final String baseUrl) {
        when(credentialRepository.findByTenantId(TENANT)).thenReturn(Mono.just(TenantCredentialEntity.builder()
                .tenantId(TENANT).baseUrl(baseUrl).dbName("db").accountLogin("api")
                .encryptedApiKey(vault.encrypt("tenant-api-key")).build()));
    }

    private static UserEntity employee(final Long employeeId) {
        return UserEntity.builder().id(7L).email("alice@example.com").fullName("Alice")
                .tenantId(TENANT).hrEmployeeId(employeeId).active(true).build();
    }

    @Test
    void leaveSubmissionIsTranslatedAndDownstreamBodyReturnedUnchanged() throws Exception {
        AtomicReference<String> sent = new AtomicReference<>();
        AtomicReference<String> auth = new AtomicReference<>();
        backend(r -> r.post("/db/ess/api/leave", (req, res) -> res.status(201)
                .header("Content-Type", "application/json")
                .sendString(req.receive().aggregate().asString().map(b -> {
                    sent.set(b);
                    auth.set(req.requestHeaders().get("Authorization"));
                    return "{\"leave_id\":99,\"state\":\"confirm\"}";
                }))));

        LeaveRequest request = new LeaveRequest(3L, LocalDate.parse("2024-01-10"), LocalDate.parse("2024-01-12"), null);

        StepVerifier.create(service.submitLeave(employee(42L), request))
                .assertNext(node -> assertThat(node.toString()).isEqualTo("{\"leave_id\":99,\"state\":\"confirm\"}"))
                .verifyComplete();

        JsonNode body = mapper.readTree(sent.get());
        assertThat(body.get("employee_id").asLong()).isEqualTo(42L);
        assertThat(body.get("leave_type_id").asLong()).isEqualTo(3L);
        assertThat(body.get("from_date").asText()).isEqualTo("2024-01-10");
        assertThat(body.get("to_date").asText()).isEqualTo("2024-01-12");
        assertThat(auth.get()).isEqualTo("Bearer tenant-api-key");
    }

    @Test
    void unlinkedUserCannotSubmitLeave() {
        LeaveRequest request = new LeaveRequest(3L, LocalDate.parse("2024-01-10"), LocalDate.parse("2024-01-12"), null);

        StepVerifier.create(service.submitLeave(employee(null), request))
                .verifyErrorSatisfies(e -> {
                    assertThat(((GatewayException) e).getKind()).isEqualTo(ErrorKind.VALIDATION);
                    assertThat(e.getMessage()).isEqualTo("User not linked to HR system");
                });
    }

    @Test
    void unlinkedUserHasNoPayslipsOrDocuments() {
        StepVerifier.create(service.payslips(employee(null)))
                .assertNext(node -> assertThat(node.isArray()).isTrue())
                .verifyComplete();
        StepVerifier.create(service.documents(employee(null)))
                .assertNext(node -> assertThat(node.size()).isZero())
                .verifyComplete();
    }

    @Test
    void unreachableBackendIsUnavailable() {
        DisposableServer closed = HttpServer.create().host("127.0.0.1").port(0).bindNow();
        int port = closed.port();
        closed.disposeNow();
        configure("http://127.0.0.1:" + port + "/db");

        StepVerifier.create(service.leaveTypes(employee(42L)))
                .verifyErrorSatisfies(e -> assertThat(((GatewayException) e).getStatus()).isEqualTo(503));
    }

    @Test
    void pendingCountFallsBackToZero() {
        backend(r -> r.get("/db/ess/api/leaves/pending-count/42", (req, res) -> res.status(500).send()));

        StepVerifier.create(service.pendingLeavesCount(employee(42L)))
                .assertNext(node -> {
                    assertThat(node.get("employee_id").asLong()).isEqualTo(42L);
                    assertThat(node.get("pending_leave_count").asInt()).isZero();
                })
                .verifyComplete();
    }

    @Test
    void profileFallsBackToLocalData() {
        backend(r -> r.get("/db/ess/api/employee/42", (req, res) -> res.status(503).send()));

        StepVerifier.create(service.profile(employee(42L)))
                .assertNext(p -> {
                    assertThat(p.email()).isEqualTo("alice@example.com");
                    assertThat(p.hrEmployeeId()).isEqualTo(42L);
                    assertThat(p.hrProfile()).isNull();
                })
                .verifyComplete();
    }

    @Test
    void profileMergesHrRecord() {
        backend(r -> r.get("/db/ess/api/employee/42", (req, res) -> res
                .header("Content-Type", "application/json")
                .sendString(Mono.just("{\"id\":42,\"job_title\":\"Engineer\"}"))));

        StepVerifier.create(service.profile(employee(42L)))
                .assertNext(p -> assertThat(p.hrProfile().get("job_title").asText()).isEqualTo("Engineer"))
                .verifyComplete();
    }

    @Test
    void connectionTestReportsFailureInsteadOfErroring() {
        when(credentialRepository.findByTenantId(TENANT)).thenReturn(Mono.empty());

        StepVerifier.create(service.testConnection(TENANT))
                .assertNext(r -> {
                    assertThat(r.status()).isEqualTo("failure");
                    assertThat(r.message()).contains("not configured");
                })
                .verifyComplete();
    }

    @Test
    void connectionTestSucceedsAgainstAuthTest() {
        backend(r -> r.get("/db/ess/api/auth-test", (req, res) -> res
                .header("Content-Type", "application/json")
                .sendString(Mono.just("{\"status\":\"success\",\"authenticated_user_login\":\"api\"}"))));

        StepVerifier.create(service.testConnection(TENANT))
                .assertNext(r -> {
                    assertThat(r.status()).isEqualTo("success");
                    assertThat(r.details().get("authenticated_user_login").asText()).isEqualTo("api");
                })
                .verifyComplete();
    }

    @Test
    void nextDayOffIsReturnedAsSent() {
        backend(r -> r.get("/db/ess/api/leaves/next-off/42", (req, res) -> res
                .header("Content-Type", "application/json")
                .sendString(Mono.just("{\"employee_id\":42,\"next_day_off\":\"2024-06-03\"}"))));

        StepVerifier.create(service.nextDayOff(employee(42L)))
                .assertNext(node -> assertThat(node.get("next_day_off").asText()).isEqualTo("2024-06-03"))
                .verifyComplete();
    }

    @Test
    void nextDayOffWithoutDateBecomesMessage() {
        backend(r -> r.get("/db/ess/api/leaves/next-off/42", (req, res) -> res
                .header("Content-Type", "application/json")
                .sendString(Mono.just("{\"employee_id\":42}"))));

        StepVerifier.create(service.nextDayOff(employee(42L)))
                .assertNext(node -> {
                    assertThat(node.get("employee_id").asLong()).isEqualTo(42L);
                    assertThat(node.get("message").asText()).isEqualTo("No upcoming approved leave found.");
                })
                .verifyComplete();
    }

    @Test
    void nextDayOffLookupFailureBecomesMessage() {
        backend(r -> r.get("/db/ess/api/leaves/next-off/42", (req, res) -> res.status(404).send()));

        StepVerifier.create(service.nextDayOff(employee(42L)))
                .assertNext(node -> assertThat(node.get("message").asText())
                        .isEqualTo("Could not retrieve leave information."))
                .verifyComplete();
    }

    @Test
    void todayLogIsWrappedWithEmployeeId() {
        backend(r -> r.get("/db/ess/api/attendance/today-log/42", (req, res) -> res
                .header("Content-Type", "application/json")
                .sendString(Mono.just("[{\"check_in\":\"2024-05-01 08:00:00\"}]"))));

        StepVerifier.create(service.todayAttendanceLog(employee(42L)))
                .assertNext(node -> {
                    assertThat(node.get("employee_id").asLong()).isEqualTo(42L);
                    assertThat(node.get("attendance_log").get(0).get("check_in").asText())
                            .isEqualTo("2024-05-01 08:00:00");
                })
                .verifyComplete();
    }

    @Test
    void todayLogDegradesOnBackendFailureButNotOnBadRequest() {
        backend(r -> r.get("/db/ess/api/attendance/today-log/42", (req, res) -> res.status(503).send())
                .get("/db/ess/api/attendance/today-log/43", (req, res) -> res.status(400)
                        .header("Content-Type", "application/json")
                        .sendString(Mono.just("{\"message\":\"bad employee\"}"))));

        StepVerifier.create(service.todayAttendanceLog(employee(42L)))
                .assertNext(node -> assertThat(node.get("message").asText()).isEqualTo("Could not retrieve attendance log."))
                .verifyComplete();
        StepVerifier.create(service.todayAttendanceLog(employee(43L)))
                .verifyErrorSatisfies(e -> assertThat(((GatewayException) e).getStatus()).isEqualTo(400));
    }

    @Test
    void unlinkedUserGetsTodayLogMessage() {
        StepVerifier.create(service.todayAttendanceLog(employee(null)))
                .assertNext(node -> assertThat(node.get("message").asText()).isEqualTo("Not linked to HR system."))
                .verifyComplete();
    }

    @Test
    void documentDeletionRelaysBackendMessageOrDefault() {
        backend(r -> r.delete("/db/ess/api/attachment/5", (req, res) -> res
                        .header("Content-Type", "application/json")
                        .sendString(Mono.just("{\"message\":\"Attachment 5 deleted.\"}")))
                .delete("/db/ess/api/attachment/6", (req, res) -> res.status(204).send()));

        StepVerifier.create(service.deleteDocument(employee(42L), 5L))
                .assertNext(node -> assertThat(node.get("message").asText()).isEqualTo("Attachment 5 deleted."))
                .verifyComplete();
        StepVerifier.create(service.deleteDocument(employee(42L), 6L))
                .assertNext(node -> assertThat(node.get("message").asText())
                        .isEqualTo("Document deletion processed by HR system."))
                .verifyComplete();
    }

    @Test
    void employeeSearchSendsTermAndLimit() {
        AtomicReference<String> uri = new AtomicReference<>();
        backend(r -> r.get("/db/ess/api/admin/employees/search", (req, res) -> {
            uri.set(req.uri());
            return res.header("Content-Type", "application/json")
                    .sendString(Mono.just("[{\"id\":42,\"name\":\"Alice Smith\"}]"));
        }));

        StepVerifier.create(service.searchEmployees(TENANT, " alice smith ", 5))
                .assertNext(node -> assertThat(node.get(0).get("id").asLong()).isEqualTo(42L))
                .verifyComplete();

        assertThat(uri.get()).contains("term=alice%20smith").contains("limit=5");
    }

    @Test
    void documentUploadSendsTypeAndFileFields() {
        AtomicReference<String> sent = new AtomicReference<>();
        backend(r -> r.post("/db/ess/api/employee/42/document", (req, res) -> res.status(201)
                .header("Content-Type", "application/json")
                .sendString(req.receive().aggregate().asString(StandardCharsets.UTF_8).map(b -> {
                    sent.set(b);
                    return "{\"attachment_id\":5}";
                }))));

        UploadPart file = new UploadPart("file", "passport.pdf", "application/pdf",
                "%PDF-1.4".getBytes(StandardCharsets.UTF_8));

        StepVerifier.create(service.uploadDocument(employee(42L), "passport", file))
                .assertNext(node -> assertThat(node.get("attachment_id").asLong()).isEqualTo(5L))
                .verifyComplete();

        assertThat(sent.get())
                .contains("name=\"document_type\"")
                .contains("passport")
                .contains("name=\"file\"; filename=\"passport.pdf\"")
                .contains("%PDF-1.4");
    }

    @Test
    void expenseSendsReceiptField() {
        AtomicReference<String> sent = new AtomicReference<>();
        backend(r -> r.post("/db/ess/api/expenses", (req, res) -> res.status(201)
                .header("Content-Type", "application/json")
                .sendString(req.receive().aggregate().asString(StandardCharsets.UTF_8).map(b -> {
                    sent.set(b);
                    return "{\"expense_id\":8}";
                }))));

        UploadPart receipt = new UploadPart("receipt", "taxi.png", "image/png", new byte[0]);

        StepVerifier.create(service.submitExpense(employee(42L), "Taxi", "12.50", "2024-05-01", receipt))
                .assertNext(node -> assertThat(node.get("expense_id").asLong()).isEqualTo(8L))
                .verifyComplete();

        assertThat(sent.get())
                .contains("name=\"receipt\"; filename=\"taxi.png\"")
                .contains("name=\"employee_id\"")
                .contains("name=\"amount\"");
    }
}
