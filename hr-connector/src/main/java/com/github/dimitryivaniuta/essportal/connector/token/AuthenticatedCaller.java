package com.github.dimitryivaniuta.essportal.connector.token;

import com.github.dimitryivaniuta.essportal.connector.model.ConnectorAccountEntity;
import com.github.dimitryivaniuta.essportal.connector.model.ServiceTokenEntity;

/**
 * A validated service token together with the account it acts as.
 */
public record AuthenticatedCaller(ServiceTokenEntity token, ConnectorAccountEntity account) {

    public TokenScope scope() {
        return token.getScope() == null ? TokenScope.unrestricted() : token.getScope();
    }
}
