package com.github.dimitryivaniuta.essportal.common.error;

import java.util.Objects;
import lombok.Getter;

/**
 * Unchecked carrier for every recoverable error in the gateway.
 * Rendered by {@link GatewayExceptionHandler} with {@link #getStatus()}.
 */
@Getter
public class GatewayException extends RuntimeException {

    private final ErrorKind kind;

    private final int status;

    public GatewayException(final ErrorKind kind, final String message) {
        this(kind, kind.getDefaultStatus().value(), message, null);
    }

    public GatewayException(final ErrorKind kind, final String message, final Throwable cause) {
        this(kind, kind.getDefaultStatus().value(), message, cause);
    }

    protected GatewayException(final ErrorKind kind, final int status, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.status = status;
    }

    public static GatewayException unauthorized(final String message) {
        return new GatewayException(ErrorKind.UNAUTHORIZED, message);
    }

    public static GatewayException forbidden(final String message) {
        return new GatewayException(ErrorKind.FORBIDDEN, message);
    }

    public static GatewayException notFound(final String message) {
        return new GatewayException(ErrorKind.NOT_FOUND, message);
    }

    public static GatewayException validation(final String message) {
        return new GatewayException(ErrorKind.VALIDATION, message);
    }

    public static GatewayException conflict(final String message) {
        return new GatewayException(ErrorKind.CONFLICT, message);
    }

    /**
     * Downstream 4xx forwarded to the caller with the same status code.
     *
     * @param status downstream status (400..499)
     * @param message caller-safe message
     */
    public static GatewayException upstreamClientError(final int status, final String message) {
        if (status < 400 || status > 499) {
            throw new IllegalArgumentException("client error status must be 4xx, got " + status);
        }
        return new GatewayException(ErrorKind.UPSTREAM_CLIENT_ERROR, status, message, null);
    }
}
