package com.github.dimitryivaniuta.essportal.gateway.downstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.essportal.common.error.ErrorKind;
import com.github.dimitryivaniuta.essportal.common.error.GatewayException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;
import org.springframework.core.codec.CodecException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Maps outbound failures onto the gateway error taxonomy.
 *
 * <ul>
 *   <li>timeouts (connect, response or overall ceiling) → {@code UPSTREAM_TIMEOUT}</li>
 *   <li>refused/unresolvable/reset connections → {@code UPSTREAM_UNAVAILABLE}</li>
 *   <li>downstream 4xx → {@code UPSTREAM_CLIENT_ERROR} with the same status</li>
 *   <li>downstream 5xx or an unreadable body → {@code UPSTREAM_BAD_RESPONSE}</li>
 * </ul>
 */
final class DownstreamErrors {

    static final String CLIENT_ERROR_PREFIX = "HR API Error: ";
    static final String DEFAULT_CLIENT_MESSAGE = "Error communicating with HR system.";
    static final int LOGGED_BODY_CHARS = 200;

    private DownstreamErrors() {
    }

    /** Status-based mapping for a downstream error response. */
    static GatewayException fromStatus(final int status, final String body, final ObjectMapper mapper) {
        if (status >= 400 && status < 500) {
            return GatewayException.upstreamClientError(status, CLIENT_ERROR_PREFIX + extractMessage(body, mapper));
        }
        return new GatewayException(ErrorKind.UPSTREAM_BAD_RESPONSE,
                "HR system returned an error (status " + status + ").");
    }

    /** Transport/decoding mapping; a {@link GatewayException} passes through unchanged. */
    static GatewayException translate(final Throwable error, final ObjectMapper mapper) {
        if (error instanceof GatewayException ge) {
            return ge;
        }
        if (error instanceof WebClientResponseException wre) {
            return fromStatus(wre.getStatusCode().value(), wre.getResponseBodyAsString(), mapper);
        }
        if (hasCause(error, TimeoutException.class) || hasCause(error, io.netty.handler.timeout.TimeoutException.class)
                || hasCause(error, io.netty.channel.ConnectTimeoutException.class)) {
            return new GatewayException(ErrorKind.UPSTREAM_TIMEOUT, "Request to HR system timed out.", error);
        }
        if (error instanceof WebClientRequestException || hasCause(error, ConnectException.class)
                || hasCause(error, UnknownHostException.class)) {
            return new GatewayException(ErrorKind.UPSTREAM_UNAVAILABLE, "Could not connect to HR service.", error);
        }
        if (hasCause(error, CodecException.class) || hasCause(error, IOException.class)) {
            return new GatewayException(ErrorKind.UPSTREAM_BAD_RESPONSE,
                    "HR system returned an unreadable response.", error);
        }
        return new GatewayException(ErrorKind.INTERNAL,
                "An unexpected error occurred while contacting the HR system.", error);
    }

    /** First {@value #LOGGED_BODY_CHARS} characters of a response body for logging. */
    static String abbreviate(final String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= LOGGED_BODY_CHARS ? body : body.substring(0, LOGGED_BODY_CHARS) + "...";
    }

    private static String extractMessage(final String body, final ObjectMapper mapper) {
        if (body == null || body.isBlank()) {
            return DEFAULT_CLIENT_MESSAGE;
        }
        try {
            JsonNode node = mapper.readTree(body);
            JsonNode message = node == null ? null : node.get("message");
            if (message != null && message.isTextual() && !message.asText().isBlank()) {
                return message.asText();
            }
        } catch (IOException e) {
            return DEFAULT_CLIENT_MESSAGE;
        }
        return DEFAULT_CLIENT_MESSAGE;
    }

    private static boolean hasCause(final Throwable error, final Class<? extends Throwable> type) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
