package com.pharmos.security;

import com.pharmos.domain.Role;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The caller of one GraphQL operation, resolved from its bearer token.
 *
 * Stored in the GraphQL context under {@link IdentityInterceptor#IDENTITY_KEY}
 * rather than a ThreadLocal, because data loaders and subscriptions complete on
 * other threads than the one that accepted the request.
 */
public class Identity {

    private final String id;
    private final String email;
    private final Role role;
    private final List<String> permissions;

    public Identity(String id, String email, Role role, List<String> permissions) {
        this.id = id;
        this.email = email;
        this.role = role;
        this.permissions = permissions != null
            ? Collections.unmodifiableList(permissions)
            : Collections.emptyList();
    }

    /**
     * @return true if this identity is an admin or holds one of {@code roles}
     */
    public boolean hasAnyRole(Role... roles) {
        if (role == Role.ADMIN) {
            return true;
        }
        return Arrays.asList(roles).contains(role);
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public String getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public Role getRole() {
        return role;
    }

    public List<String> getPermissions() {
        return permissions;
    }

    @Override
    public String toString() {
        return "Identity{id='" + id + "', role=" + role + "}";
    }
}
