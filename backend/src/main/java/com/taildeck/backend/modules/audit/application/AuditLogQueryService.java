package com.taildeck.backend.modules.audit.application;

import java.util.List;

import com.taildeck.backend.global.error.ProblemException;
import com.taildeck.backend.modules.audit.domain.AuditLog;
import com.taildeck.backend.modules.audit.domain.AuditResourceType;
import com.taildeck.backend.modules.audit.infrastructure.persistence.AuditLogRepository;
import com.taildeck.backend.modules.audit.infrastructure.persistence.AuditLogSearchCondition;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class AuditLogQueryService {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;
    public static final int MAX_RECENT_LIMIT = 20;

    private final AuditLogRepository auditLogRepository;

    public AuditLogQueryService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    public AuditLogPage query(AuditLogFilter filter) {
        if (filter.startDate() != null && filter.endDate() != null && filter.startDate().isAfter(filter.endDate())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_DATE_RANGE", "Invalid date range",
                    "startDate must not be after endDate");
        }
        int limit = clampLimit(filter.limit(), MAX_LIMIT);
        int offset = filter.offset() == null ? 0 : Math.max(0, filter.offset());

        AuditLogSearchCondition condition = new AuditLogSearchCondition(
                filter.action(),
                filter.resourceType(),
                filter.resourceId(),
                filter.actorUserId(),
                filter.startDate(),
                filter.endDate()
        );
        List<AuditLog> entries = auditLogRepository.search(condition, offset, limit);
        long total = auditLogRepository.countMatching(condition);
        return new AuditLogPage(entries, total, limit, offset);
    }

    public List<AuditLog> recent(Integer limit) {
        return auditLogRepository.search(AuditLogSearchCondition.none(), 0, clampLimit(limit, MAX_RECENT_LIMIT));
    }

    public List<AuditLog> resourceHistory(AuditResourceType resourceType, String resourceId, Integer limit) {
        AuditLogSearchCondition condition = new AuditLogSearchCondition(null, resourceType, resourceId, null, null, null);
        return auditLogRepository.search(condition, 0, clampLimit(limit, MAX_LIMIT));
    }

    static int clampLimit(Integer requested, int max) {
        if (requested == null) {
            return Math.min(DEFAULT_LIMIT, max);
        }
        return Math.max(1, Math.min(requested, max));
    }
}
