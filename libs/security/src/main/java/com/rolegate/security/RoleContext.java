package com.rolegate.security;

import java.util.Optional;

/**
 * Request-scoped collaborator supplying the current user and a debug log sink.
 */
public interface RoleContext {

    /** The currently authenticated user, if any. */
    Optional<User> currentUser();

    /** Whether decisions should be written to {@link #logDebug(String)}. */
    boolean isDebugEnabled();

    /** Writes a debug line. Only called when {@link #isDebugEnabled()} is true. */
    void logDebug(String message);
}
