package com.rolegate.security;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Thrown when the subject lacks one or more required roles.
 * <p>
 * The message lists exactly the missing roles, sorted, e.g.
 * {@code "Missing roles: moose_feeder, moose_groomer"}.
 */
public class MissingRolesException extends AuthorizationException {

    private final SortedSet<String> missingRoles;

    public MissingRolesException(Collection<String> missingRoles) {
        this(Collections.unmodifiableSortedSet(new TreeSet<>(missingRoles)));
    }

    private MissingRolesException(SortedSet<String> missingRoles) {
        super("Missing roles: " + String.join(", ", missingRoles));
        this.missingRoles = missingRoles;
    }

    /** The required roles the subject does not hold, in natural order. */
    public SortedSet<String> missingRoles() {
        return missingRoles;
    }
}
