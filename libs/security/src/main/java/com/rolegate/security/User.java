package com.rolegate.security;

import java.util.Collection;

/**
 * A subject whose roles can be checked.
 * <p>
 * Owned by the authentication layer; the checker only reads from it.
 */
public interface User {

    /**
     * Returns the roles this user currently holds.
     * <p>
     * {@code candidateRoles} is the list of roles being checked. It is passed
     * through as a hint only: implementations return their full role set and
     * must not filter by it.
     *
     * @param candidateRoles roles the caller is about to check
     * @return the roles held by this user (never filtered by the hint)
     */
    Collection<String> roles(Collection<String> candidateRoles);
}
