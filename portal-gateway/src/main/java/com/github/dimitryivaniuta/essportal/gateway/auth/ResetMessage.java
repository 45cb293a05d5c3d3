package com.github.dimitryivaniuta.essportal.gateway.auth;

/**
 * Outgoing password reset email.
 */
public record ResetMessage(String to, String recipientName, String resetLink, long validMinutes) {

    @Override
    public String toString() {
        return "ResetMessage[to=" + to + ", validMinutes=" + validMinutes + "]";
    }
}
