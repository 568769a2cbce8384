package com.taildeck.backend.modules.identity.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record UserRoleResponse(String role, String source, UUID grantedBy, OffsetDateTime grantedAt) {
}
