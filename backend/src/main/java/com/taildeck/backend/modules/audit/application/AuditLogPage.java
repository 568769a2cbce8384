package com.taildeck.backend.modules.audit.application;

import java.util.List;

import com.taildeck.backend.modules.audit.domain.AuditLog;

public record AuditLogPage(List<AuditLog> entries, long total, int limit, int offset) {

    public boolean hasMore() {
        return (long) offset + entries.size() < total;
    }
}
