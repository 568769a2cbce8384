package com.taildeck.backend.modules.rbac.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 내장 역할. 레벨이 높을수록 권한이 크다.
 */
public enum RoleName {

    OWNER(100, "Full access to everything including role management"),
    ADMIN(80, "Manage configuration, users, ACLs, DNS; cannot assign OWNER role"),
    OPERATOR(60, "Manage machines, routes, health checks; cannot change ACLs/DNS"),
    AUDITOR(40, "Read-only access to all screens including audit log"),
    USER(20, "User portal only; manage own devices and keys");

    private final int level;
    private final String description;

    RoleName(int level, String description) {
        this.level = level;
        this.description = description;
    }

    public int level() {
        return level;
    }

    public String description() {
        return description;
    }

    public static Optional<RoleName> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(role -> role.name().equals(raw.trim()))
                .findFirst();
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(Enum::name).toList();
    }
}
