package com.github.dimitryivaniuta.essportal.common.error;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

class GatewayExceptionHandlerTest {

    private final GatewayExceptionHandler handler = new GatewayExceptionHandler();

    @Test
    void rendersKindStatusAndMessage() {
        ResponseEntity<ApiError> resp = handler.handleGateway(
                new GatewayException(ErrorKind.UPSTREAM_UNAVAILABLE, "Could not connect to HR service"));

        assertThat(resp.getStatusCode().value()).isEqualTo(503);
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().code()).isEqualTo("UPSTREAM_UNAVAILABLE");
        assertThat(resp.getBody().message()).isEqualTo("Could not connect to HR service");
        assertThat(resp.getBody().timestamp()).isNotNull();
    }

    @Test
    void passesDownstreamClientStatusThrough() {
        ResponseEntity<ApiError> resp = handler.handleGateway(
                GatewayException.upstreamClientError(409, "HR API Error: overlapping leave"));

        assertThat(resp.getStatusCode().value()).isEqualTo(409);
        assertThat(resp.getBody().code()).isEqualTo("UPSTREAM_CLIENT_ERROR");
    }

    @Test
    void upstreamClientErrorRejectsNon4xx() {
        assertThatThrownBy(() -> GatewayException.upstreamClientError(502, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void configurationErrorsRenderAs500() {
        ResponseEntity<ApiError> resp = handler.handleGateway(new ConfigurationException("Security configuration error."));

        assertThat(resp.getStatusCode().value()).isEqualTo(500);
        assertThat(resp.getBody().code()).isEqualTo("CONFIGURATION");
    }

    @Test
    void unexpectedErrorsHideDetails() {
        ResponseEntity<ApiError> resp = handler.handleUnexpected(new NullPointerException("secret internals"));

        assertThat(resp.getStatusCode().value()).isEqualTo(500);
        assertThat(resp.getBody().message()).doesNotContain("secret internals");
    }
}
