package com.pharmos.security;

import com.pharmos.domain.Role;
import com.pharmos.graphql.GraphQLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Identity and role checks run at the top of every root resolver.
 */
@Component
public class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    /**
     * @return the identity, never null
     * @throws GraphQLException UNAUTHENTICATED if there is no identity
     */
    public Identity requireIdentity(Identity identity) {
        if (identity == null) {
            log.warn("Rejected unauthenticated request");
            throw GraphQLException.unauthenticated();
        }
        return identity;
    }

    /**
     * Require an identity holding one of {@code roles}. Admin satisfies any role.
     *
     * @throws GraphQLException UNAUTHENTICATED without identity, FORBIDDEN with an insufficient role
     */
    public Identity requireRole(Identity identity, Role... roles) {
        requireIdentity(identity);
        if (!identity.hasAnyRole(roles)) {
            log.warn("Identity {} lacks required role {}", identity.getId(), Arrays.toString(roles));
            throw GraphQLException.forbidden("Requires one of roles " + Arrays.toString(roles));
        }
        return identity;
    }

    /**
     * Pass when {@code allowed} holds for this caller or the caller has one of {@code roles}.
     * Used for ownership rules such as "project lead or admin".
     */
    public Identity requireOwnerOrRole(Identity identity, boolean allowed, Role... roles) {
        requireIdentity(identity);
        if (!allowed && !identity.hasAnyRole(roles)) {
            log.warn("Identity {} is neither owner nor one of {}", identity.getId(), Arrays.toString(roles));
            throw GraphQLException.forbidden("Not permitted to modify this resource");
        }
        return identity;
    }
}
