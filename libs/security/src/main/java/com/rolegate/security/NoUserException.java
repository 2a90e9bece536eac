package com.rolegate.security;

/**
 * Thrown when no user was supplied and the context has no logged in user.
 */
public class NoUserException extends AuthorizationException {

    public NoUserException() {
        super("no logged in user, and none supplied as argument");
    }
}
