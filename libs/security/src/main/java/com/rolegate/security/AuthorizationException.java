package com.rolegate.security;

/**
 * Base class for authorization failures raised by {@link RoleChecker}.
 * <p>
 * WHY a RuntimeException: a failed assertion aborts the protected operation.
 * It propagates to whatever turns it into a response, without every caller
 * declaring it. Fail fast and loud.
 */
public abstract class AuthorizationException extends RuntimeException {

    protected AuthorizationException(String message) {
        super(message);
    }
}
