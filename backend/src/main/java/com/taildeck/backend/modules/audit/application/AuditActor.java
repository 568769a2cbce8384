package com.taildeck.backend.modules.audit.application;

import java.util.UUID;

import com.taildeck.backend.global.security.authorization.AuthenticatedContext;

public record AuditActor(UUID userId, String email, String ip) {

    public static AuditActor from(AuthenticatedContext context) {
        return new AuditActor(context.userId(), context.email(), context.clientIp());
    }
}
