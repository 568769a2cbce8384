package com.taildeck.backend.modules.audit.infrastructure.persistence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.taildeck.backend.modules.audit.domain.AuditLog;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import org.springframework.stereotype.Repository;

@Repository
public class AuditLogRepositoryImpl implements AuditLogRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<AuditLog> search(AuditLogSearchCondition condition, int offset, int limit) {
        Objects.requireNonNull(condition, "condition must not be null");
        Map<String, Object> params = new HashMap<>();
        String where = buildWhereClause(condition, params);

        TypedQuery<AuditLog> query = entityManager.createQuery(
                "select al from AuditLog al" + where + " order by al.createdAt desc, al.id desc",
                AuditLog.class);
        params.forEach(query::setParameter);
        query.setFirstResult(offset);
        query.setMaxResults(limit);
        return query.getResultList();
    }

    @Override
    public long countMatching(AuditLogSearchCondition condition) {
        Objects.requireNonNull(condition, "condition must not be null");
        Map<String, Object> params = new HashMap<>();
        String where = buildWhereClause(condition, params);

        TypedQuery<Long> query = entityManager.createQuery("select count(al) from AuditLog al" + where, Long.class);
        params.forEach(query::setParameter);
        return query.getSingleResult();
    }

    private String buildWhereClause(AuditLogSearchCondition condition, Map<String, Object> params) {
        List<String> clauses = new ArrayList<>();

        if (condition.action() != null) {
            clauses.add("al.action = :action");
            params.put("action", condition.action());
        }
        if (condition.resourceType() != null) {
            clauses.add("al.resourceType = :resourceType");
            params.put("resourceType", condition.resourceType());
        }
        if (condition.resourceId() != null) {
            clauses.add("al.resourceId = :resourceId");
            params.put("resourceId", condition.resourceId());
        }
        if (condition.actorUserId() != null) {
            clauses.add("al.actorUserId = :actorUserId");
            params.put("actorUserId", condition.actorUserId());
        }
        if (condition.startDate() != null) {
            clauses.add("al.createdAt >= :startDate");
            params.put("startDate", condition.startDate());
        }
        if (condition.endDate() != null) {
            clauses.add("al.createdAt <= :endDate");
            params.put("endDate", condition.endDate());
        }
        return clauses.isEmpty() ? "" : " where " + String.join(" and ", clauses);
    }
}
