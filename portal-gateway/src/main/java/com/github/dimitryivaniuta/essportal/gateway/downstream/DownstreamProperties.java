package com.github.dimitryivaniuta.essportal.gateway.downstream;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Outbound HR backend client settings.
 *
 * @param timeout        ceiling for every outbound call (JSON, multipart, download headers)
 * @param connectTimeout TCP connect timeout
 * @param apiPrefix      path prefix of the ESS API on every tenant's backend
 */
@Validated
@ConfigurationProperties(prefix = "downstream")
public record DownstreamProperties(
        @DefaultValue("PT30S") Duration timeout,
        @DefaultValue("PT5S") Duration connectTimeout,
        @DefaultValue("/ess/api") @NotBlank String apiPrefix
) { }
