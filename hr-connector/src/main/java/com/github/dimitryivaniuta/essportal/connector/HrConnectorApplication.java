package com.github.dimitryivaniuta.essportal.connector;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the HR connector: the service-token guard in front of the HR backend's ESS API.
 */
@Slf4j
@SpringBootApplication
public class HrConnectorApplication {

    public static void main(final String[] args) {
        SpringApplication.run(HrConnectorApplication.class, args);
        log.info("HR connector started successfully.");
    }
}
