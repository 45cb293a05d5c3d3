package com.github.dimitryivaniuta.essportal.connector.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.core.userdetails.MapReactiveUserDetailsService;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.server.SecurityWebFilterChain;

/**
 * Reactive security configuration.
 * ESS API routes are guarded by {@code InboundGuard} with service tokens, so Spring Security
 * only protects token administration (HTTP Basic) and leaves {@code /ess/api/**} open.
 */
@Configuration
@EnableWebFluxSecurity
public class SecurityConfig {

    static final String ROLE_ADMIN = "ADMIN";

    @Bean
    public SecurityWebFilterChain springSecurityFilterChain(final ServerHttpSecurity http) {
        return http
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .logout(ServerHttpSecurity.LogoutSpec::disable)
                .httpBasic(Customizer.withDefaults())
                .authorizeExchange(ex -> ex
                        .pathMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        .pathMatchers("/actuator/health", "/ess/api/**").permitAll()
                        .pathMatchers("/admin/**").hasRole(ROLE_ADMIN)
                        .anyExchange().denyAll()
                )
                .build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(12);
    }

    @Bean
    public MapReactiveUserDetailsService adminUserDetailsService(final ConnectorProperties properties,
                                                                 final PasswordEncoder passwordEncoder) {
        UserDetails admin = User.withUsername(properties.admin().username())
                .password(passwordEncoder.encode(properties.admin().password()))
                .roles(ROLE_ADMIN)
                .build();
        return new MapReactiveUserDetailsService(admin);
    }
}
