/**
 * Role-based authorization checks on top of an authentication layer.
 *
 * <p>{@link com.rolegate.security.RoleChecker} decides whether a subject's roles are a superset of
 * a required role list. The subject is a {@link com.rolegate.security.User}, either passed in or
 * taken from the request's {@link com.rolegate.security.RoleContext}.
 *
 * <p>Role storage, role hierarchies and authentication itself belong to the host application.
 *
 * @see com.rolegate.security.RoleChecker
 * @see com.rolegate.security.Slf4jRoleContext
 */
package com.rolegate.security;
