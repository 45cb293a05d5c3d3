package com.github.dimitryivaniuta.essportal.common.error;

/**
 * Missing or unusable secret material.
 *
 * <p>Thrown from bean construction it aborts startup. Thrown per request (for example a
 * stored ciphertext that no longer decrypts) it renders as a 500 and the process keeps running.</p>
 */
public class ConfigurationException extends GatewayException {

    public ConfigurationException(final String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, cause);
    }
}
