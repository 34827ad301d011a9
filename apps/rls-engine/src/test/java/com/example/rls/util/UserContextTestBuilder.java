package com.example.rls.util;

import com.example.rls.model.UserSecurityContext;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Test builder for UserSecurityContext.
 */
public class UserContextTestBuilder {

    private String userId = "user-001";
    private String username = "jdoe";
    private String email = "jdoe@example.com";
    private Set<String> roles = new HashSet<>();
    private Map<String, Object> attributes = new HashMap<>();

    public static UserContextTestBuilder aUser() {
        return new UserContextTestBuilder();
    }

    public static UserSecurityContext aUserWithRoles(String... roleIds) {
        return aUser().withRoles(roleIds).build();
    }

    public UserContextTestBuilder withUserId(String userId) {
        this.userId = userId;
        return this;
    }

    public UserContextTestBuilder withUsername(String username) {
        this.username = username;
        return this;
    }

    public UserContextTestBuilder withEmail(String email) {
        this.email = email;
        return this;
    }

    public UserContextTestBuilder withRoles(String... roleIds) {
        this.roles = new HashSet<>(Set.of(roleIds));
        return this;
    }

    public UserContextTestBuilder withAttribute(String key, Object value) {
        this.attributes.put(key, value);
        return this;
    }

    public UserSecurityContext build() {
        return new UserSecurityContext(userId, username, email, roles, attributes);
    }
}
