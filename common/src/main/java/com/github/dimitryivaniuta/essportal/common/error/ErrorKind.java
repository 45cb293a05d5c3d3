package com.github.dimitryivaniuta.essportal.common.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Error taxonomy shared by the portal gateway and the HR connector.
 *
 * <p>Each kind carries the HTTP status it renders with. {@link #UPSTREAM_CLIENT_ERROR}
 * is the exception: its status is taken from the downstream response.</p>
 */
@Getter
public enum ErrorKind {

    /** Bad, expired or missing bearer credential. */
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),

    /** Valid credential with insufficient scope, privilege or origin. */
    FORBIDDEN(HttpStatus.FORBIDDEN),

    /** Referenced tenant, user or record is absent. */
    NOT_FOUND(HttpStatus.NOT_FOUND),

    /** Malformed caller input. */
    VALIDATION(HttpStatus.BAD_REQUEST),

    /** Request clashes with existing state, e.g. deleting a referenced row. */
    CONFLICT(HttpStatus.CONFLICT),

    /** Tenant has no downstream connection configured. */
    NOT_CONFIGURED(HttpStatus.SERVICE_UNAVAILABLE),

    /** Downstream answered 4xx; status is passed through. */
    UPSTREAM_CLIENT_ERROR(HttpStatus.BAD_REQUEST),

    /** Downstream did not answer within the call ceiling. */
    UPSTREAM_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT),

    /** Downstream could not be reached. */
    UPSTREAM_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),

    /** Downstream answered 5xx or with an unparsable body. */
    UPSTREAM_BAD_RESPONSE(HttpStatus.BAD_GATEWAY),

    /** Missing or unusable secrets (signing key, vault key, stored ciphertext). */
    CONFIGURATION(HttpStatus.INTERNAL_SERVER_ERROR),

    /** Anything else. */
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus defaultStatus;

    ErrorKind(final HttpStatus defaultStatus) {
        this.defaultStatus = defaultStatus;
    }
}
