package com.taildeck.backend.modules.audit.infrastructure.persistence;

import java.util.Optional;

import com.taildeck.backend.modules.audit.domain.AuditLog;

import org.springframework.data.repository.Repository;

/**
 * 추가와 조회만 노출한다. 감사 로그는 수정/삭제 경로가 없다.
 */
public interface AuditLogRepository extends Repository<AuditLog, Long>, AuditLogRepositoryCustom {

    AuditLog save(AuditLog auditLog);

    Optional<AuditLog> findById(Long id);

    long count();
}
