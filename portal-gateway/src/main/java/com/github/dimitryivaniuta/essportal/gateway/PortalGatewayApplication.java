package com.github.dimitryivaniuta.essportal.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the ESS portal gateway.
 * Bootstraps Spring WebFlux, the token service and the HR backend proxy.
 */
@Slf4j
@SpringBootApplication
public class PortalGatewayApplication {

    /**
     * Main method to launch the portal gateway.
     *
     * @param args command-line arguments passed to the application
     */
    public static void main(final String[] args) {
        SpringApplication.run(PortalGatewayApplication.class, args);
        log.info("Portal gateway started successfully.");
    }
}
