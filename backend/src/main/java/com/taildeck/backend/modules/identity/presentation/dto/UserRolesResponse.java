package com.taildeck.backend.modules.identity.presentation.dto;

import java.util.List;
import java.util.UUID;

public record UserRolesResponse(
        UUID userId,
        String email,
        String name,
        String effectiveRole,
        List<UserRoleResponse> roles
) {
}
