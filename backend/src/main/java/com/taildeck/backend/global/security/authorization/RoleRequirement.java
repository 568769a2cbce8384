package com.taildeck.backend.global.security.authorization;

import java.util.List;
import java.util.Objects;

import com.taildeck.backend.modules.rbac.domain.RoleName;

public record RoleRequirement(Mode mode, List<RoleName> anyOf, RoleName minimum) {

    public enum Mode {
        AUTHENTICATED,
        ANY_OF,
        MINIMUM
    }

    public RoleRequirement {
        Objects.requireNonNull(mode, "mode");
        anyOf = anyOf == null ? List.of() : List.copyOf(anyOf);
        if (mode == Mode.ANY_OF && anyOf.isEmpty()) {
            throw new IllegalArgumentException("ANY_OF requirement needs at least one role");
        }
        if (mode == Mode.MINIMUM && minimum == null) {
            throw new IllegalArgumentException("MINIMUM requirement needs a role");
        }
    }

    public static RoleRequirement authenticated() {
        return new RoleRequirement(Mode.AUTHENTICATED, List.of(), null);
    }

    public static RoleRequirement anyOf(RoleName... roles) {
        return new RoleRequirement(Mode.ANY_OF, List.of(roles), null);
    }

    public static RoleRequirement minimum(RoleName role) {
        return new RoleRequirement(Mode.MINIMUM, List.of(), role);
    }
}
