package com.github.dimitryivaniuta.essportal.gateway.security;

import com.github.dimitryivaniuta.essportal.gateway.auth.TokenService;
import java.util.Collection;
import java.util.List;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Grants {@code ROLE_USER} to every authenticated caller and {@code ROLE_ADMIN} when the
 * token carries {@code is_admin=true}.
 */
public class AdminClaimAuthoritiesConverter implements Converter<Jwt, Collection<GrantedAuthority>> {

    public static final String ROLE_USER = "ROLE_USER";
    public static final String ROLE_ADMIN = "ROLE_ADMIN";

    @Override
    public Collection<GrantedAuthority> convert(final Jwt jwt) {
        Object flag = jwt.getClaims().get(TokenService.CLAIM_ADMIN);
        if (Boolean.TRUE.equals(flag)) {
            return List.of(new SimpleGrantedAuthority(ROLE_USER), new SimpleGrantedAuthority(ROLE_ADMIN));
        }
        return List.of(new SimpleGrantedAuthority(ROLE_USER));
    }
}
