package com.rolegate.security;

import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import java.util.Optional;

/**
 * {@link RoleContext} that writes decisions to an SLF4J {@link Logger}.
 * <p>
 * When no explicit debug flag is given, the flag follows
 * {@link Logger#isDebugEnabled()} at the time of each check. A {@code null}
 * logger is replaced by the no-op logger, so decisions are silently dropped.
 *
 * @param logger      debug sink
 * @param user        the current user, or {@code null} when nobody is logged in
 * @param debugFlag   explicit debug flag, or {@code null} to follow the logger level
 */
public record Slf4jRoleContext(Logger logger, User user, Boolean debugFlag) implements RoleContext {

    public Slf4jRoleContext {
        logger = logger == null ? NOPLogger.NOP_LOGGER : logger;
    }

    /**
     * Context for the given user, debug flag following the logger level.
     */
    public static Slf4jRoleContext of(Logger logger, User user) {
        return new Slf4jRoleContext(logger, user, null);
    }

    /**
     * Context with no logged in user.
     */
    public static Slf4jRoleContext anonymous(Logger logger) {
        return new Slf4jRoleContext(logger, null, null);
    }

    /**
     * Context with an explicit debug flag, independent of the logger level.
     */
    public static Slf4jRoleContext withDebug(Logger logger, User user, boolean debug) {
        return new Slf4jRoleContext(logger, user, debug);
    }

    @Override
    public Optional<User> currentUser() {
        return Optional.ofNullable(user);
    }

    @Override
    public boolean isDebugEnabled() {
        return debugFlag != null ? debugFlag : logger.isDebugEnabled();
    }

    @Override
    public void logDebug(String message) {
        logger.debug(message);
    }
}
