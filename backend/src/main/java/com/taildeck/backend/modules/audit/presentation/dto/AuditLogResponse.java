package com.taildeck.backend.modules.audit.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;

public record AuditLogResponse(
        Long id,
        String action,
        UUID actorUserId,
        String actorEmail,
        String actorIp,
        String resourceType,
        String resourceId,
        JsonNode oldValue,
        JsonNode newValue,
        JsonNode metadata,
        OffsetDateTime createdAt
) {
}
