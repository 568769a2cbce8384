package com.taildeck.backend.modules.audit.presentation.dto;

import java.util.List;

public record AuditLogListResponse(
        List<AuditLogResponse> entries,
        long total,
        int limit,
        int offset,
        boolean hasMore
) {
}
