package com.taildeck.backend.modules.auth.presentation.dto;

import java.util.List;
import java.util.UUID;

public record UserProfileResponse(
        UUID userId,
        String email,
        String name,
        List<String> roles,
        String effectiveRole,
        List<String> permissions
) {
}
