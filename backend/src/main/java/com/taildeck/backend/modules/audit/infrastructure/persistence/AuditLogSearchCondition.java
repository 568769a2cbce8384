package com.taildeck.backend.modules.audit.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.taildeck.backend.modules.audit.domain.AuditAction;
import com.taildeck.backend.modules.audit.domain.AuditResourceType;

/**
 * 감사 로그 검색 조건. null인 항목은 필터에서 제외되고 나머지는 AND로 결합된다.
 */
public record AuditLogSearchCondition(
        AuditAction action,
        AuditResourceType resourceType,
        String resourceId,
        UUID actorUserId,
        OffsetDateTime startDate,
        OffsetDateTime endDate
) {

    public AuditLogSearchCondition {
        if (resourceId != null && resourceId.isBlank()) {
            resourceId = null;
        }
    }

    public static AuditLogSearchCondition none() {
        return new AuditLogSearchCondition(null, null, null, null, null, null);
    }
}
