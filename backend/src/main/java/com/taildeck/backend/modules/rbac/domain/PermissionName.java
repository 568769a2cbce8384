package com.taildeck.backend.modules.rbac.domain;

import java.util.Arrays;
import java.util.Optional;

public enum PermissionName {

    NODES_READ("nodes", "read"),
    NODES_WRITE("nodes", "write"),
    NODES_DELETE("nodes", "delete"),
    ROUTES_READ("routes", "read"),
    ROUTES_WRITE("routes", "write"),
    ACL_READ("acl", "read"),
    ACL_WRITE("acl", "write"),
    USERS_READ("users", "read"),
    USERS_WRITE("users", "write"),
    USERS_DELETE("users", "delete"),
    KEYS_READ("keys", "read"),
    KEYS_WRITE("keys", "write"),
    KEYS_DELETE("keys", "delete"),
    AUDIT_READ("audit", "read"),
    SETTINGS_READ("settings", "read"),
    SETTINGS_WRITE("settings", "write"),
    ROLES_READ("roles", "read"),
    ROLES_WRITE("roles", "write");

    private final String resource;
    private final String action;

    PermissionName(String resource, String action) {
        this.resource = resource;
        this.action = action;
    }

    public String resource() {
        return resource;
    }

    public String action() {
        return action;
    }

    /** {@code resource:action} 형태의 저장/표시용 이름. */
    public String value() {
        return resource + ":" + action;
    }

    public boolean isReadOnly() {
        return "read".equals(action);
    }

    public static Optional<PermissionName> fromValue(String value) {
        return Arrays.stream(values())
                .filter(permission -> permission.value().equals(value))
                .findFirst();
    }
}
