package com.taildeck.backend.modules.audit.infrastructure.persistence;

import java.util.List;

import com.taildeck.backend.modules.audit.domain.AuditLog;

public interface AuditLogRepositoryCustom {

    /**
     * 최신순(created_at desc, id desc)으로 정렬된 검색 결과.
     */
    List<AuditLog> search(AuditLogSearchCondition condition, int offset, int limit);

    long countMatching(AuditLogSearchCondition condition);
}
