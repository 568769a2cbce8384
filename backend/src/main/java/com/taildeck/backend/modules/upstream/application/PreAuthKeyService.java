package com.taildeck.backend.modules.upstream.application;

import java.util.List;

import com.taildeck.backend.global.error.ProblemException;
import com.taildeck.backend.global.security.authorization.AuthenticatedContext;
import com.taildeck.backend.modules.audit.application.AuditActor;
import com.taildeck.backend.modules.audit.application.AuditEntry;
import com.taildeck.backend.modules.audit.application.AuditLogService;
import com.taildeck.backend.modules.audit.domain.AuditAction;
import com.taildeck.backend.modules.audit.domain.AuditResourceType;
import com.taildeck.backend.modules.upstream.client.GatewayResult;
import com.taildeck.backend.modules.upstream.client.UpstreamClient;
import com.taildeck.backend.modules.upstream.client.dto.PreAuthKey;
import com.taildeck.backend.modules.upstream.client.dto.UpstreamRequests;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
public class PreAuthKeyService {

    private static final Logger log = LoggerFactory.getLogger(PreAuthKeyService.class);

    static final String RESOURCE = "Pre-auth key";
    // 감사 로그에는 키 원문 대신 앞부분만 남긴다
    static final int KEY_AUDIT_PREFIX_LENGTH = 8;

    private final UpstreamClient upstreamClient;
    private final AuditLogService auditLogService;
    private final GatewayErrorTranslator errorTranslator;

    public PreAuthKeyService(UpstreamClient upstreamClient, AuditLogService auditLogService,
                             GatewayErrorTranslator errorTranslator) {
        this.upstreamClient = upstreamClient;
        this.auditLogService = auditLogService;
        this.errorTranslator = errorTranslator;
    }

    public List<PreAuthKey> listKeys(String user) {
        requireUser(user);
        return unwrap(upstreamClient.listPreAuthKeys(user));
    }

    public PreAuthKey createKey(AuthenticatedContext context, CreatePreAuthKeyCommand command) {
        requireUser(command.user());
        PreAuthKey created = unwrap(upstreamClient.createPreAuthKey(new UpstreamRequests.CreatePreAuthKey(
                command.user(), command.reusable(), command.ephemeral(), command.expiration(), command.aclTags())));
        auditLogService.logAudit(
                AuditEntry.of(AuditAction.CREATE_KEY, AuditActor.from(context), AuditResourceType.KEY, created.id())
                        .withMetadata(AuditValues.of(
                                "headscaleUser", command.user(),
                                "reusable", command.reusable(),
                                "ephemeral", command.ephemeral(),
                                "aclTags", command.aclTags())));
        log.info("Pre-auth key {} created for {} by {}", created.id(), command.user(), context.userId());
        return created;
    }

    public void expireKey(AuthenticatedContext context, String user, String key) {
        requireUser(user);
        if (key == null || key.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "key is required");
        }
        unwrap(upstreamClient.expirePreAuthKey(user, key));
        String keyPrefix = key.length() > KEY_AUDIT_PREFIX_LENGTH ? key.substring(0, KEY_AUDIT_PREFIX_LENGTH) : key;
        auditLogService.logAudit(
                AuditEntry.of(AuditAction.EXPIRE_KEY, AuditActor.from(context), AuditResourceType.KEY, keyPrefix)
                        .withMetadata(AuditValues.of("headscaleUser", user)));
        log.info("Pre-auth key {}... for {} expired by {}", keyPrefix, user, context.userId());
    }

    private static void requireUser(String user) {
        if (user == null || user.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "user is required");
        }
    }

    private <T> T unwrap(GatewayResult<T> result) {
        return result.orElseThrow(error -> errorTranslator.translate(error, RESOURCE));
    }
}
