package com.rolegate.security.testing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for TestRoleContextFactory.
 */
@DisplayName("TestRoleContextFactory")
class TestRoleContextFactoryTest {

    @Test
    @DisplayName("createWithRoles() produces a context with a user holding those roles")
    void createWithRoles() {
        var ctx = TestRoleContextFactory.createWithRoles("admin", "user");
        assertThat(ctx.currentUser()).isPresent();
        assertThat(ctx.currentUser().get().roles(List.of()))
                .containsExactlyInAnyOrder("admin", "user");
        assertThat(ctx.isDebugEnabled()).isTrue();
    }

    @Test
    @DisplayName("userWithRoles() uses the default test user id")
    void userWithRoles() {
        var user = TestRoleContextFactory.userWithRoles("admin");
        assertThat(user.userId()).isEqualTo(TestRoleContextFactory.TEST_USER_ID);
        assertThat(user.roles()).containsExactly("admin");
    }

    @Test
    @DisplayName("anonymous() has no current user")
    void anonymous() {
        assertThat(TestRoleContextFactory.anonymous().currentUser()).isEmpty();
    }
}
