package com.rolegate.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the authorization exception messages and accessors.
 */
@DisplayName("Authorization exceptions")
class MissingRolesExceptionTest {

    @Test
    @DisplayName("message lists missing roles sorted and comma separated")
    void messageSorted() {
        var e = new MissingRolesException(Set.of("moose_feeder", "admin", "janitor"));
        assertThat(e).hasMessage("Missing roles: admin, janitor, moose_feeder");
        assertThat(e.missingRoles()).containsExactly("admin", "janitor", "moose_feeder");
    }

    @Test
    @DisplayName("missing roles are unmodifiable")
    void unmodifiable() {
        var e = new MissingRolesException(List.of("admin"));
        assertThatThrownBy(() -> e.missingRoles().add("user"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("both errors share the AuthorizationException base")
    void commonBase() {
        assertThat(new MissingRolesException(List.of("admin"))).isInstanceOf(AuthorizationException.class);
        assertThat(new NoUserException())
                .isInstanceOf(AuthorizationException.class)
                .hasMessage("no logged in user, and none supplied as argument");
    }
}
