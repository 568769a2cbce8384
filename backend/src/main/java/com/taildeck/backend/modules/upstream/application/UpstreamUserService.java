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
import com.taildeck.backend.modules.upstream.client.dto.UpstreamUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Headscale 쪽 사용자(네임스페이스) 관리. 로컬 app_user 와는 별개다.
 */
@Service
public class UpstreamUserService {

    private static final Logger log = LoggerFactory.getLogger(UpstreamUserService.class);

    static final String RESOURCE = "User";

    private final UpstreamClient upstreamClient;
    private final AuditLogService auditLogService;
    private final GatewayErrorTranslator errorTranslator;

    public UpstreamUserService(UpstreamClient upstreamClient, AuditLogService auditLogService,
                               GatewayErrorTranslator errorTranslator) {
        this.upstreamClient = upstreamClient;
        this.auditLogService = auditLogService;
        this.errorTranslator = errorTranslator;
    }

    public List<UpstreamUser> listUsers() {
        return unwrap(upstreamClient.listUsers());
    }

    public UpstreamUser createUser(AuthenticatedContext context, String name) {
        UpstreamUser created = unwrap(upstreamClient.createUser(name));
        auditLogService.logAudit(AuditEntry.of(AuditAction.CREATE_USER, AuditActor.from(context),
                        AuditResourceType.USER, name)
                .withNewValue(created)
                .withMetadata(AuditValues.of("headscaleUserId", created.id())));
        log.info("Headscale user {} created by {}", name, context.userId());
        return created;
    }

    public UpstreamUser renameUser(AuthenticatedContext context, String oldName, String newName) {
        UpstreamUser renamed = unwrap(upstreamClient.renameUser(oldName, newName));
        auditLogService.logAudit(AuditEntry.of(AuditAction.RENAME_USER, AuditActor.from(context),
                        AuditResourceType.USER, newName)
                .withOldValue(AuditValues.of("name", oldName))
                .withNewValue(AuditValues.of("name", newName)));
        log.info("Headscale user {} renamed to {} by {}", oldName, newName, context.userId());
        return renamed;
    }

    public void deleteUser(AuthenticatedContext context, String name) {
        unwrap(upstreamClient.deleteUser(name));
        auditLogService.logAudit(AuditEntry.of(AuditAction.DELETE_USER, AuditActor.from(context),
                AuditResourceType.USER, name));
        log.info("Headscale user {} deleted by {}", name, context.userId());
    }

    private <T> T unwrap(GatewayResult<T> result) {
        return result.orElseThrow(error -> errorTranslator.translate(error, RESOURCE));
    }
}
