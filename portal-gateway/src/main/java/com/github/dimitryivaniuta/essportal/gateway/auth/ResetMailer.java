package com.github.dimitryivaniuta.essportal.gateway.auth;

import reactor.core.publisher.Mono;

/**
 * Delivers password reset emails.
 */
public interface ResetMailer {

    /**
     * @return completes once the message is handed to the transport, errors otherwise
     */
    Mono<Void> send(ResetMessage message);
}
