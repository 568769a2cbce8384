package com.taildeck.backend.modules.rbac.presentation.dto;

import java.util.List;

public record RoleResponse(
        String name,
        String description,
        int level,
        boolean system,
        List<String> permissions,
        boolean assignable
) {
}
