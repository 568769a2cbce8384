package com.taildeck.backend.modules.upstream.application;

import java.util.List;

import com.taildeck.backend.global.security.authorization.AuthenticatedContext;
import com.taildeck.backend.modules.audit.application.AuditActor;
import com.taildeck.backend.modules.audit.application.AuditEntry;
import com.taildeck.backend.modules.audit.application.AuditLogService;
import com.taildeck.backend.modules.audit.domain.AuditAction;
import com.taildeck.backend.modules.audit.domain.AuditResourceType;
import com.taildeck.backend.modules.upstream.client.GatewayResult;
import com.taildeck.backend.modules.upstream.client.UpstreamClient;
import com.taildeck.backend.modules.upstream.client.dto.ApiKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Headscale API 키 관리. 생성된 키 원문은 감사 로그에 남기지 않는다.
 */
@Service
public class ApiKeyService {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyService.class);

    static final String RESOURCE = "API key";
    static final String NEW_KEY_RESOURCE_ID = "new";

    private final UpstreamClient upstreamClient;
    private final AuditLogService auditLogService;
    private final GatewayErrorTranslator errorTranslator;

    public ApiKeyService(UpstreamClient upstreamClient, AuditLogService auditLogService,
                         GatewayErrorTranslator errorTranslator) {
        this.upstreamClient = upstreamClient;
        this.auditLogService = auditLogService;
        this.errorTranslator = errorTranslator;
    }

    public List<ApiKey> listApiKeys() {
        return unwrap(upstreamClient.listApiKeys());
    }

    public String createApiKey(AuthenticatedContext context, String expiration) {
        String normalizedExpiration = expiration == null || expiration.isBlank() ? null : expiration;
        String apiKey = unwrap(upstreamClient.createApiKey(normalizedExpiration));
        auditLogService.logAudit(AuditEntry.of(AuditAction.CREATE_API_KEY, AuditActor.from(context),
                        AuditResourceType.API_KEY, NEW_KEY_RESOURCE_ID)
                .withMetadata(AuditValues.of(
                        "hasExpiration", normalizedExpiration != null,
                        "expiration", normalizedExpiration)));
        log.info("API key created by {}", context.userId());
        return apiKey;
    }

    public void expireApiKey(AuthenticatedContext context, String prefix) {
        unwrap(upstreamClient.expireApiKey(prefix));
        auditLogService.logAudit(AuditEntry.of(AuditAction.EXPIRE_API_KEY, AuditActor.from(context),
                AuditResourceType.API_KEY, prefix));
        log.info("API key {} expired by {}", prefix, context.userId());
    }

    public void deleteApiKey(AuthenticatedContext context, String prefix) {
        unwrap(upstreamClient.deleteApiKey(prefix));
        auditLogService.logAudit(AuditEntry.of(AuditAction.DELETE_API_KEY, AuditActor.from(context),
                AuditResourceType.API_KEY, prefix));
        log.info("API key {} deleted by {}", prefix, context.userId());
    }

    private <T> T unwrap(GatewayResult<T> result) {
        return result.orElseThrow(error -> errorTranslator.translate(error, RESOURCE));
    }
}
