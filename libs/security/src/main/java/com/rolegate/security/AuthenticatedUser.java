package com.rolegate.security;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Immutable {@link User} holding a fixed role set.
 * <p>
 * WHY a record: immutable, thread-safe, auto-generated equals/hashCode/toString.
 * The role set is copied on construction, so the snapshot a check sees cannot
 * change under it.
 *
 * @param userId unique user identifier
 * @param roles  roles granted to the user
 */
public record AuthenticatedUser(String userId, Set<String> roles) implements User {

    public AuthenticatedUser {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (roles == null) {
            roles = Set.of();
        } else {
            for (String role : roles) {
                if (role == null) {
                    throw new IllegalArgumentException("roles must not contain null");
                }
            }
            roles = Set.copyOf(roles);
        }
    }

    /**
     * Creates a user with the given roles.
     */
    public static AuthenticatedUser of(String userId, String... roles) {
        return new AuthenticatedUser(userId, roles == null ? null : new HashSet<>(Arrays.asList(roles)));
    }

    /**
     * Returns the full role set; the candidate list is ignored.
     */
    @Override
    public Collection<String> roles(Collection<String> candidateRoles) {
        return roles;
    }
}
