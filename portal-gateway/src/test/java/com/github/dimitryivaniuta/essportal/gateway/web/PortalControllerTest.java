package com.github.dimitryivaniuta.essportal.gateway.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.essportal.gateway.downstream.UploadPart;
import com.github.dimitryivaniuta.essportal.gateway.model.UserEntity;
import com.github.dimitryivaniuta.essportal.gateway.service.CurrentUserResolver;
import com.github.dimitryivaniuta.essportal.gateway.service.HrPortalService;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.security.oauth2.jwt.Jwt;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
class PortalControllerTest {

    @Mock
    private CurrentUserResolver currentUser;

    @Mock
    private HrPortalService portalService;

    @Mock
    private FilePart filePart;

    private final JsonNode created = new ObjectMapper().createObjectNode().put("id", 5);

    private final UserEntity alice = UserEntity.builder().id(7L).email("alice@example.com")
            .tenantId(1L).hrEmployeeId(42L).active(true).build();

    private PortalController controller;

    @BeforeEach
    void setUp() {
        controller = new PortalController(currentUser, portalService);
        when(currentUser.resolve("alice@example.com")).thenReturn(Mono.just(alice));
    }

    private static Jwt jwt() {
        return Jwt.withTokenValue("token").header("alg", "HS256").subject("alice@example.com").build();
    }

    private void file(final String filename, final MediaType type, final Flux<DataBuffer> content) {
        HttpHeaders headers = new HttpHeaders();
        if (type != null) {
            headers.setContentType(type);
        }
        when(filePart.headers()).thenReturn(headers);
        when(filePart.filename()).thenReturn(filename);
        when(filePart.content()).thenReturn(content);
    }

    private static Flux<DataBuffer> bytes(final String... chunks) {
        return Flux.fromArray(chunks)
                .map(c -> DefaultDataBufferFactory.sharedInstance.wrap(c.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void emptyDocumentIsStillForwarded() {
        file("empty.pdf", MediaType.APPLICATION_PDF, Flux.empty());
        when(portalService.uploadDocument(eq(alice), eq("passport"), any())).thenReturn(Mono.just(created));

        StepVerifier.create(controller.uploadDocument(jwt(), "passport", filePart))
                .expectNext(created)
                .verifyComplete();

        ArgumentCaptor<UploadPart> part = ArgumentCaptor.forClass(UploadPart.class);
        verify(portalService).uploadDocument(eq(alice), eq("passport"), part.capture());
        assertThat(part.getValue().name()).isEqualTo("file");
        assertThat(part.getValue().filename()).isEqualTo("empty.pdf");
        assertThat(part.getValue().contentType()).isEqualTo("application/pdf");
        assertThat(part.getValue().content()).isEmpty();
    }

    @Test
    void documentChunksAreJoined() {
        file("cv.txt", null, bytes("hello ", "world"));
        when(portalService.uploadDocument(eq(alice), eq("cv"), any())).thenReturn(Mono.just(created));

        StepVerifier.create(controller.uploadDocument(jwt(), "cv", filePart))
                .expectNext(created)
                .verifyComplete();

        ArgumentCaptor<UploadPart> part = ArgumentCaptor.forClass(UploadPart.class);
        verify(portalService).uploadDocument(eq(alice), eq("cv"), part.capture());
        assertThat(new String(part.getValue().content(), StandardCharsets.UTF_8)).isEqualTo("hello world");
        assertThat(part.getValue().contentType()).isEqualTo(MediaType.APPLICATION_OCTET_STREAM_VALUE);
    }

    @Test
    void receiptIsForwardedUnderReceiptName() {
        file("taxi.png", MediaType.IMAGE_PNG, Flux.empty());
        when(portalService.submitExpense(eq(alice), eq("Taxi"), eq("12.50"), eq("2024-05-01"), any()))
                .thenReturn(Mono.just(created));

        StepVerifier.create(controller.submitExpense(jwt(), "Taxi", "12.50", "2024-05-01", filePart))
                .expectNext(created)
                .verifyComplete();

        ArgumentCaptor<UploadPart> part = ArgumentCaptor.forClass(UploadPart.class);
        verify(portalService).submitExpense(eq(alice), eq("Taxi"), eq("12.50"), eq("2024-05-01"), part.capture());
        assertThat(part.getValue().name()).isEqualTo("receipt");
        assertThat(part.getValue().filename()).isEqualTo("taxi.png");
    }
}
