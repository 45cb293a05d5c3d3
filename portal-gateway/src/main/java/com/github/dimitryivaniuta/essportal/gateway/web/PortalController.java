package com.github.dimitryivaniuta.essportal.gateway.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.essportal.gateway.downstream.DownstreamDownload;
import com.github.dimitryivaniuta.essportal.gateway.downstream.UploadPart;
import com.github.dimitryivaniuta.essportal.gateway.model.UserEntity;
import com.github.dimitryivaniuta.essportal.gateway.service.CurrentUserResolver;
import com.github.dimitryivaniuta.essportal.gateway.service.HrPortalService;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.LeaveRequest;
import com.github.dimitryivaniuta.essportal.gateway.web.dto.UserProfileResponse;
import jakarta.validation.Valid;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Employee self-service endpoints. Every call acts on behalf of the token subject.
 */
@Slf4j
@Validated
@RestController
@RequestMapping(path = "/api/v1")
@RequiredArgsConstructor
public class PortalController {

    private final CurrentUserResolver currentUser;

    private final HrPortalService portalService;

    @GetMapping(path = "/users/me", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<UserProfileResponse> me(@AuthenticationPrincipal final Jwt jwt) {
        return as(jwt, portalService::profile);
    }

    @GetMapping(path = "/leave-types", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<JsonNode> leaveTypes(@AuthenticationPrincipal final Jwt jwt) {
        return as(jwt, portalService::leaveTypes);
    }

    @ResponseStatus(HttpStatus.CREATED)
    @PostMapping(path = "/leave-request", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<JsonNode> submitLeave(@AuthenticationPrincipal final Jwt jwt,
                                      @Valid @RequestBody final LeaveRequest request) {
        return as(jwt, user -> portalService.submitLeave(user, request));
    }

    @GetMapping(path = "/dashboard/pending-leaves-count", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<JsonNode> pendingLeavesCount(@AuthenticationPrincipal final Jwt jwt) {
        return as(jwt, portalService::pendingLeavesCount);
    }

    @GetMapping(path = "/dashboard/next-day-off", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<JsonNode> nextDayOff(@AuthenticationPrincipal final Jwt jwt) {
        return as(jwt, portalService::nextDayOff);
    }

    @GetMapping(path = "/payslips", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<JsonNode> payslips(@AuthenticationPrincipal final Jwt jwt) {
        return as(jwt, portalService::payslips);
    }

    @GetMapping(path = "/payslip/{id}/download")
    public Mono<ResponseEntity<Flux<DataBuffer>>> downloadPayslip(@AuthenticationPrincipal final Jwt jwt,
                                                                  @PathVariable("id") final long id) {
        return as(jwt, user -> portalService.downloadPayslip(user, id)).map(DownstreamDownload::toResponseEntity);
    }

    @ResponseStatus(HttpStatus.CREATED)
    @PostMapping(path = "/expenses", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<JsonNode> submitExpense(@AuthenticationPrincipal final Jwt jwt,
                                        @RequestPart("description") final String description,
                                        @RequestPart("amount") final String amount,
                                        @RequestPart("date") final String date,
                                        @RequestPart("receipt") final FilePart receipt) {
        return buffer("receipt", receipt).flatMap(part ->
                as(jwt, user -> portalService.submitExpense(user, description, amount, date, part)));
    }

    @GetMapping(path = "/documents", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<JsonNode> documents(@AuthenticationPrincipal final Jwt jwt) {
        return as(jwt, portalService::documents);
    }

    @ResponseStatus(HttpStatus.CREATED)
    @PostMapping(path = "/documents", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<JsonNode> uploadDocument(@AuthenticationPrincipal final Jwt jwt,
                                         @RequestPart("document_type") final String documentType,
                                         @RequestPart("file") final FilePart file) {
        return buffer("file", file).flatMap(part ->
                as(jwt, user -> portalService.uploadDocument(user, documentType, part)));
    }

    @GetMapping(path = "/document/{id}/download")
    public Mono<ResponseEntity<Flux<DataBuffer>>> downloadDocument(@AuthenticationPrincipal final Jwt jwt,
                                                                   @PathVariable("id") final long id) {
        return as(jwt, user -> portalService.downloadDocument(user, id)).map(DownstreamDownload::toResponseEntity);
    }

    @DeleteMapping(path = "/document/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<JsonNode> deleteDocument(@AuthenticationPrincipal final Jwt jwt, @PathVariable("id") final long id) {
        return as(jwt, user -> portalService.deleteDocument(user, id));
    }

    @GetMapping(path = "/attendance/today-log", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<JsonNode> todayAttendanceLog(@AuthenticationPrincipal final Jwt jwt) {
        return as(jwt, portalService::todayAttendanceLog);
    }

    @GetMapping(path = "/attendance/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<JsonNode> attendanceStatus(@AuthenticationPrincipal final Jwt jwt) {
        return as(jwt, portalService::attendanceStatus);
    }

    @PostMapping(path = "/attendance/check-in", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<JsonNode> checkIn(@AuthenticationPrincipal final Jwt jwt) {
        return as(jwt, portalService::checkIn);
    }

    @PostMapping(path = "/attendance/check-out", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<JsonNode> checkOut(@AuthenticationPrincipal final Jwt jwt) {
        return as(jwt, portalService::checkOut);
    }

    private <T> Mono<T> as(final Jwt jwt, final Function<UserEntity, Mono<T>> operation) {
        return currentUser.resolve(jwt.getSubject()).flatMap(operation);
    }

    /** Reads a file part into memory; a zero-byte upload is still forwarded. */
    static Mono<UploadPart> buffer(final String name, final FilePart file) {
        String contentType = file.headers().getContentType() == null
                ? MediaType.APPLICATION_OCTET_STREAM_VALUE
                : file.headers().getContentType().toString();
        return DataBufferUtils.join(file.content())
                .map(joined -> {
                    byte[] bytes = new byte[joined.readableByteCount()];
                    joined.read(bytes);
                    DataBufferUtils.release(joined);
                    return new UploadPart(name, file.filename(), contentType, bytes);
                })
                .defaultIfEmpty(new UploadPart(name, file.filename(), contentType, new byte[0]));
    }
}
