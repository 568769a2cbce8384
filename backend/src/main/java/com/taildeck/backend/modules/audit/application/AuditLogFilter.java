package com.taildeck.backend.modules.audit.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.taildeck.backend.modules.audit.domain.AuditAction;
import com.taildeck.backend.modules.audit.domain.AuditResourceType;

public record AuditLogFilter(
        AuditAction action,
        AuditResourceType resourceType,
        String resourceId,
        UUID actorUserId,
        OffsetDateTime startDate,
        OffsetDateTime endDate,
        Integer limit,
        Integer offset
) {

    public static AuditLogFilter unfiltered(Integer limit, Integer offset) {
        return new AuditLogFilter(null, null, null, null, null, null, limit, offset);
    }
}
