package com.taildeck.backend.modules.upstream.application;

import com.taildeck.backend.global.error.ProblemException;
import com.taildeck.backend.global.security.authorization.AuthenticatedContext;
import com.taildeck.backend.modules.audit.application.AuditActor;
import com.taildeck.backend.modules.audit.application.AuditEntry;
import com.taildeck.backend.modules.audit.application.AuditLogService;
import com.taildeck.backend.modules.audit.domain.AuditAction;
import com.taildeck.backend.modules.audit.domain.AuditResourceType;
import com.taildeck.backend.modules.upstream.client.GatewayResult;
import com.taildeck.backend.modules.upstream.client.UpstreamClient;
import com.taildeck.backend.modules.upstream.client.dto.PolicyResponse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
public class PolicyService {

    private static final Logger log = LoggerFactory.getLogger(PolicyService.class);

    static final String RESOURCE = "Policy";
    static final String AUDIT_RESOURCE_ID = "policy";

    private final UpstreamClient upstreamClient;
    private final AuditLogService auditLogService;
    private final GatewayErrorTranslator errorTranslator;
    private final ObjectMapper objectMapper;

    public PolicyService(UpstreamClient upstreamClient, AuditLogService auditLogService,
                         GatewayErrorTranslator errorTranslator, ObjectMapper objectMapper) {
        this.upstreamClient = upstreamClient;
        this.auditLogService = auditLogService;
        this.errorTranslator = errorTranslator;
        this.objectMapper = objectMapper;
    }

    public PolicyResponse getPolicy() {
        return unwrap(upstreamClient.getPolicy());
    }

    public PolicyResponse updatePolicy(AuthenticatedContext context, String policy) {
        validate(policy);

        // 이전 정책은 감사용으로만 읽으므로 실패해도 갱신을 막지 않는다
        GatewayResult<PolicyResponse> previous = upstreamClient.getPolicy();
        String previousPolicy = null;
        if (previous.isSuccess()) {
            previousPolicy = previous.value().policy();
        } else {
            log.warn("Could not read current policy before update: {}", previous.error().kind());
        }

        PolicyResponse updated = unwrap(upstreamClient.setPolicy(policy));
        auditLogService.logAudit(
                AuditEntry.of(AuditAction.UPDATE_ACL, AuditActor.from(context), AuditResourceType.ACL, AUDIT_RESOURCE_ID)
                        .withOldValue(previousPolicy != null ? AuditValues.of("policy", previousPolicy) : null)
                        .withNewValue(AuditValues.of("policy", policy))
                        .withMetadata(AuditValues.of("policyLength", policy.length())));
        log.info("ACL policy updated by {} ({} chars)", context.userId(), policy.length());
        return updated;
    }

    private void validate(String policy) {
        if (policy == null || policy.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_POLICY", "Policy is required");
        }
        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(policy);
        } catch (JsonProcessingException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_POLICY", "Invalid policy JSON",
                    ex.getOriginalMessage());
        }
        if (parsed == null || !parsed.isObject()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_POLICY", "Invalid policy JSON",
                    "Policy must be a JSON object");
        }
    }

    private <T> T unwrap(GatewayResult<T> result) {
        return result.orElseThrow(error -> errorTranslator.translate(error, RESOURCE));
    }
}
