package com.github.dimitryivaniuta.essportal.gateway.config;

import com.github.dimitryivaniuta.essportal.gateway.auth.PasswordResetProperties;
import com.github.dimitryivaniuta.essportal.gateway.downstream.DownstreamProperties;
import com.github.dimitryivaniuta.essportal.gateway.security.JwtProperties;
import com.github.dimitryivaniuta.essportal.gateway.vault.VaultProperties;
import java.time.Clock;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Registers config properties for the gateway.
 */
@AutoConfiguration
@EnableConfigurationProperties({
        JwtProperties.class,
        VaultProperties.class,
        DownstreamProperties.class,
        PasswordResetProperties.class,
})
public class GatewayPropertiesAutoConfiguration {

    /** UTC clock used for token expiry and reset-token deadlines. */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
