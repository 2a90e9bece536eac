package com.rolegate.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Role-based access control checker.
 * <p>
 * A subject is authorized when its roles are a superset of the required
 * roles. The subject is either passed explicitly or taken from
 * {@link RoleContext#currentUser()}. There is no role hierarchy: every
 * required role must be held directly.
 * <p>
 * WHY a utility class: the decision is a pure set comparison over the
 * current role snapshot, with no state of its own. Every protected operation
 * calls the same static methods instead of carrying a checker instance.
 * <p>
 * Two conventions are offered:
 * <ul>
 *   <li>{@code assertRoles} throws {@link NoUserException} or
 *       {@link MissingRolesException};</li>
 *   <li>{@code checkRoles} returns {@code false} instead of throwing.</li>
 * </ul>
 *
 * <pre>{@code
 * RoleChecker.assertRoles(ctx, "admin");          // only admins can delete
 * repository.delete(id);
 *
 * if (RoleChecker.checkRoles(ctx, "editor")) {
 *     view.showEditButton();
 * }
 * }</pre>
 */
public final class RoleChecker {

    private static final Logger LOG = LoggerFactory.getLogger(RoleChecker.class);

    private RoleChecker() {
        // utility class
    }

    /**
     * Asserts that the context's current user holds all of the given roles.
     *
     * @throws NoUserException       if the context has no current user
     * @throws MissingRolesException if any role is missing
     */
    public static void assertRoles(RoleContext context, String... requiredRoles) {
        assertRoles(context, asList(requiredRoles));
    }

    /**
     * Asserts that {@code user} holds all of the given roles. The context's
     * current user is not consulted.
     *
     * @throws MissingRolesException if any role is missing
     */
    public static void assertRoles(RoleContext context, User user, String... requiredRoles) {
        assertRoles(context, user, asList(requiredRoles));
    }

    /**
     * Collection form of {@link #assertRoles(RoleContext, String...)}.
     */
    public static void assertRoles(RoleContext context, Collection<String> requiredRoles) {
        evaluate(context, Optional.empty(), requiredRoles).orElseThrow();
    }

    /**
     * Collection form of {@link #assertRoles(RoleContext, User, String...)}.
     */
    public static void assertRoles(RoleContext context, User user, Collection<String> requiredRoles) {
        evaluate(context, Optional.of(requireUser(user)), requiredRoles).orElseThrow();
    }

    /**
     * Returns true if the context's current user holds all of the given roles.
     * Never throws.
     */
    public static boolean checkRoles(RoleContext context, String... requiredRoles) {
        return check(() -> assertRoles(context, requiredRoles));
    }

    /**
     * Returns true if {@code user} holds all of the given roles. Never throws.
     */
    public static boolean checkRoles(RoleContext context, User user, String... requiredRoles) {
        return check(() -> assertRoles(context, user, requiredRoles));
    }

    public static boolean checkRoles(RoleContext context, Collection<String> requiredRoles) {
        return check(() -> assertRoles(context, requiredRoles));
    }

    public static boolean checkRoles(RoleContext context, User user, Collection<String> requiredRoles) {
        return check(() -> assertRoles(context, user, requiredRoles));
    }

    /**
     * Evaluates the role check without throwing for authorization failures.
     *
     * @param context       supplies the current user and the debug sink
     * @param explicitUser  subject to check instead of the context's current user
     * @param requiredRoles roles the subject must hold; may be empty
     * @return granted, or denied with a {@link NoUserException} or {@link MissingRolesException}
     * @throws IllegalArgumentException if an argument or a required role is null
     */
    public static RoleCheckResult evaluate(
            RoleContext context,
            Optional<User> explicitUser,
            Collection<String> requiredRoles
    ) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        if (explicitUser == null) {
            throw new IllegalArgumentException("explicitUser must not be null");
        }
        if (requiredRoles == null) {
            throw new IllegalArgumentException("requiredRoles must not be null");
        }
        for (String role : requiredRoles) {
            if (role == null) {
                throw new IllegalArgumentException("requiredRoles must not contain null");
            }
        }

        Optional<User> subject = explicitUser.isPresent() ? explicitUser : context.currentUser();
        if (subject.isEmpty()) {
            return RoleCheckResult.denied(new NoUserException());
        }

        List<String> hint = List.copyOf(requiredRoles);
        Collection<String> held = subject.get().roles(hint);
        Set<String> have = held == null ? Set.of() : new HashSet<>(held);
        Set<String> need = new HashSet<>(hint);

        if (have.containsAll(need)) {
            debug(context, "Role granted: " + String.join(", ", need));
            return RoleCheckResult.granted();
        }

        debug(context, "Role denied: " + String.join(", ", need));
        Set<String> missing = new HashSet<>(need);
        missing.removeAll(have);
        return RoleCheckResult.denied(new MissingRolesException(missing));
    }

    // VirtualMachineError leaves the JVM unusable and is never turned into a decision
    private static boolean check(Runnable assertion) {
        try {
            assertion.run();
            return true;
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            LOG.debug("Role check failed: {}", e.toString());
            return false;
        }
    }

    // the sink must not influence the decision
    private static void debug(RoleContext context, String message) {
        try {
            if (context.isDebugEnabled()) {
                context.logDebug(message);
            }
        } catch (RuntimeException e) {
            LOG.warn("Debug log sink failed for message '{}'", message, e);
        }
    }

    private static User requireUser(User user) {
        if (user == null) {
            throw new IllegalArgumentException("user must not be null");
        }
        return user;
    }

    private static List<String> asList(String[] roles) {
        if (roles == null) {
            throw new IllegalArgumentException("requiredRoles must not be null");
        }
        return Arrays.asList(roles);
    }
}
