package com.github.dimitryivaniuta.essportal.gateway.auth;

import com.github.dimitryivaniuta.essportal.common.error.ErrorKind;
import com.github.dimitryivaniuta.essportal.common.error.GatewayException;
import java.io.Serial;

/**
 * Reset token is unknown, expired, already used or belongs to a disabled user.
 */
public class InvalidResetTokenException extends GatewayException {

    @Serial
    private static final long serialVersionUID = 1L;

    public InvalidResetTokenException() {
        super(ErrorKind.VALIDATION, "Invalid or expired password reset token.");
    }
}
