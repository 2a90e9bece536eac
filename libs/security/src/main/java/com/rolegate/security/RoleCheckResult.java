package com.rolegate.security;

import java.util.Optional;

/**
 * Outcome of {@link RoleChecker#evaluate}.
 * <p>
 * Either granted ({@code error} is null) or denied with the
 * {@link AuthorizationException} describing why.
 * <p>
 * WHY a record: immutable, clear API. Either granted or denied with a reason.
 * Both the throwing and the boolean conventions of {@link RoleChecker} read
 * this one value.
 *
 * @param error the reason for denial, or {@code null} when granted
 */
public record RoleCheckResult(AuthorizationException error) {

    private static final RoleCheckResult GRANTED = new RoleCheckResult(null);

    /** Creates a granted result. */
    public static RoleCheckResult granted() {
        return GRANTED;
    }

    /** Creates a denied result carrying the given error. */
    public static RoleCheckResult denied(AuthorizationException error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new RoleCheckResult(error);
    }

    public boolean isGranted() {
        return error == null;
    }

    /** The denial reason, empty when granted. */
    public Optional<AuthorizationException> failure() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns normally when granted, otherwise throws the carried error.
     *
     * @throws AuthorizationException if the result is denied
     */
    public void orElseThrow() {
        if (error != null) {
            throw error;
        }
    }
}
