package com.taildeck.backend.modules.audit.presentation.dto;

import java.util.List;

import com.taildeck.backend.modules.audit.application.AuditLogPage;
import com.taildeck.backend.modules.audit.domain.AuditLog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;

import org.springframework.stereotype.Component;

@Component
public class AuditLogDtoMapper {

    private final ObjectMapper objectMapper;

    public AuditLogDtoMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public AuditLogListResponse toListResponse(AuditLogPage page) {
        return new AuditLogListResponse(
                toResponses(page.entries()),
                page.total(),
                page.limit(),
                page.offset(),
                page.hasMore()
        );
    }

    public List<AuditLogResponse> toResponses(List<AuditLog> logs) {
        return logs.stream().map(this::toResponse).toList();
    }

    public AuditLogResponse toResponse(AuditLog auditLog) {
        return new AuditLogResponse(
                auditLog.getId(),
                auditLog.getAction().name(),
                auditLog.getActorUserId(),
                auditLog.getActorEmail(),
                auditLog.getActorIp(),
                auditLog.getResourceType().name(),
                auditLog.getResourceId(),
                readJson(auditLog.getOldValue()),
                readJson(auditLog.getNewValue()),
                readJson(auditLog.getMetadata()),
                auditLog.getCreatedAt()
        );
    }

    private JsonNode readJson(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException ex) {
            // 과거에 평문으로 저장된 값은 문자열 그대로 돌려준다
            return TextNode.valueOf(raw);
        }
    }
}
