package com.taildeck.backend.modules.audit.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.taildeck.backend.modules.audit.domain.AuditAction;
import com.taildeck.backend.modules.audit.domain.AuditResourceType;

/**
 * 기록할 감사 항목. old/new 값과 metadata는 JSON으로 직렬화 가능한 객체여야 한다.
 */
public record AuditEntry(
        AuditAction action,
        AuditActor actor,
        AuditResourceType resourceType,
        String resourceId,
        Object oldValue,
        Object newValue,
        Map<String, Object> metadata
) {

    public AuditEntry {
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(actor, "actor is required");
        Objects.requireNonNull(resourceType, "resourceType is required");
    }

    public static AuditEntry of(AuditAction action, AuditActor actor, AuditResourceType resourceType, String resourceId) {
        return new AuditEntry(action, actor, resourceType, resourceId, null, null, null);
    }

    public AuditEntry withOldValue(Object value) {
        return new AuditEntry(action, actor, resourceType, resourceId, value, newValue, metadata);
    }

    public AuditEntry withNewValue(Object value) {
        return new AuditEntry(action, actor, resourceType, resourceId, oldValue, value, metadata);
    }

    public AuditEntry withMetadata(Map<String, Object> values) {
        return new AuditEntry(action, actor, resourceType, resourceId, oldValue, newValue, values);
    }

    public AuditEntry withMetadata(String key, Object value) {
        Map<String, Object> merged = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return new AuditEntry(action, actor, resourceType, resourceId, oldValue, newValue, merged);
    }
}
