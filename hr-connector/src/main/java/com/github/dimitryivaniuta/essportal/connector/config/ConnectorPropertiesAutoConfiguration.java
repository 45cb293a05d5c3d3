package com.github.dimitryivaniuta.essportal.connector.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Registers config properties for the connector.
 */
@AutoConfiguration
@EnableConfigurationProperties(ConnectorProperties.class)
public class ConnectorPropertiesAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
