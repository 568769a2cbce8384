package com.taildeck.backend.modules.upstream.application;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.taildeck.backend.modules.audit.domain.AuditAction;
import com.taildeck.backend.modules.rbac.domain.RoleName;

public enum BulkNodeAction {
    DELETE(AuditAction.BULK_DELETE, RoleName.ADMIN),
    EXPIRE(AuditAction.BULK_EXPIRE, RoleName.OPERATOR),
    MOVE(AuditAction.BULK_MOVE, RoleName.OPERATOR),
    TAGS(AuditAction.BULK_TAGS, RoleName.OPERATOR);

    private final AuditAction auditAction;
    private final RoleName minimumRole;

    BulkNodeAction(AuditAction auditAction, RoleName minimumRole) {
        this.auditAction = auditAction;
        this.minimumRole = minimumRole;
    }

    public AuditAction auditAction() {
        return auditAction;
    }

    public RoleName minimumRole() {
        return minimumRole;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<BulkNodeAction> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim();
        return Arrays.stream(values())
                .filter(action -> action.value().equalsIgnoreCase(normalized))
                .findFirst();
    }

    public static List<String> valuesAsText() {
        return Arrays.stream(values()).map(BulkNodeAction::value).toList();
    }
}
