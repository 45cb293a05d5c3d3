package com.github.dimitryivaniuta.essportal.connector.web.dto;

import com.github.dimitryivaniuta.essportal.common.security.BearerTokenExtractor;
import com.github.dimitryivaniuta.essportal.connector.model.ServiceTokenEntity;
import com.github.dimitryivaniuta.essportal.connector.token.ResourceKind;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Token as shown to administrators. The full value is only returned right after it was
 * generated; listings carry an abbreviation.
 */
public record ServiceTokenResponse(
        Long id,
        String label,
        Long accountId,
        String token,
        List<String> scope,
        boolean active,
        OffsetDateTime lastUsedAt,
        String note,
        OffsetDateTime createdAt
) {

    public static ServiceTokenResponse revealed(final ServiceTokenEntity e) {
        return from(e, e.getToken());
    }

    public static ServiceTokenResponse masked(final ServiceTokenEntity e) {
        return from(e, BearerTokenExtractor.abbreviate(e.getToken()));
    }

    private static ServiceTokenResponse from(final ServiceTokenEntity e, final String token) {
        List<String> scope = e.getScope() == null
                ? List.of()
                : e.getScope().kinds().stream().map(ResourceKind::tag).sorted().toList();
        return new ServiceTokenResponse(e.getId(), e.getLabel(), e.getAccountId(), token, scope,
                e.isActive(), e.getLastUsedAt(), e.getNote(), e.getCreatedAt());
    }
}
