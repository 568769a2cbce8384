package com.taildeck.backend.modules.audit.presentation;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.UUID;

import com.taildeck.backend.global.error.InvalidParameterException;
import com.taildeck.backend.global.error.ProblemException;
import com.taildeck.backend.global.security.authorization.RequiresRoles;
import com.taildeck.backend.modules.audit.application.AuditLogFilter;
import com.taildeck.backend.modules.audit.application.AuditLogQueryService;
import com.taildeck.backend.modules.audit.domain.AuditAction;
import com.taildeck.backend.modules.audit.domain.AuditResourceType;
import com.taildeck.backend.modules.audit.presentation.dto.AuditLogDtoMapper;
import com.taildeck.backend.modules.audit.presentation.dto.AuditLogListResponse;
import com.taildeck.backend.modules.audit.presentation.dto.AuditLogResponse;
import com.taildeck.backend.modules.rbac.domain.RoleName;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/audit")
@Tag(name = "Audit", description = "감사 로그 조회")
@RequiresRoles({RoleName.AUDITOR, RoleName.OPERATOR, RoleName.ADMIN, RoleName.OWNER})
public class AuditLogController {

    private final AuditLogQueryService auditLogQueryService;
    private final AuditLogDtoMapper auditLogDtoMapper;

    public AuditLogController(AuditLogQueryService auditLogQueryService, AuditLogDtoMapper auditLogDtoMapper) {
        this.auditLogQueryService = auditLogQueryService;
        this.auditLogDtoMapper = auditLogDtoMapper;
    }

    @GetMapping
    @Operation(summary = "감사 로그 검색", description = "필터는 AND로 결합되며 최신순으로 반환된다")
    public ResponseEntity<AuditLogListResponse> query(
            @RequestParam(name = "action", required = false) String action,
            @RequestParam(name = "resourceType", required = false) String resourceType,
            @RequestParam(name = "resourceId", required = false) String resourceId,
            @RequestParam(name = "userId", required = false) String userId,
            @RequestParam(name = "startDate", required = false) String startDate,
            @RequestParam(name = "endDate", required = false) String endDate,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "offset", required = false) Integer offset
    ) {
        AuditLogFilter filter = new AuditLogFilter(
                parseAction(action),
                parseResourceType(resourceType),
                resourceId,
                parseUserId(userId),
                parseDate("startDate", startDate),
                parseDate("endDate", endDate),
                limit,
                offset
        );
        return ResponseEntity.ok(auditLogDtoMapper.toListResponse(auditLogQueryService.query(filter)));
    }

    @GetMapping("/recent")
    @Operation(summary = "최근 감사 로그")
    public ResponseEntity<List<AuditLogResponse>> recent(
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return ResponseEntity.ok(auditLogDtoMapper.toResponses(auditLogQueryService.recent(limit)));
    }

    @GetMapping("/resources/{resourceType}/{resourceId}")
    @Operation(summary = "특정 리소스의 감사 이력")
    public ResponseEntity<List<AuditLogResponse>> resourceHistory(
            @PathVariable("resourceType") String resourceType,
            @PathVariable("resourceId") String resourceId,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        AuditResourceType type = parseResourceType(resourceType);
        return ResponseEntity.ok(auditLogDtoMapper.toResponses(
                auditLogQueryService.resourceHistory(type, resourceId, limit)));
    }

    private AuditAction parseAction(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return AuditAction.valueOf(raw.trim());
        } catch (IllegalArgumentException ex) {
            throw new InvalidParameterException("action", AuditAction.names());
        }
    }

    private AuditResourceType parseResourceType(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return AuditResourceType.valueOf(raw.trim());
        } catch (IllegalArgumentException ex) {
            throw new InvalidParameterException("resourceType", AuditResourceType.names());
        }
    }

    private UUID parseUserId(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_USER_ID", "Invalid userId");
        }
    }

    private OffsetDateTime parseDate(String name, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw.trim());
        } catch (DateTimeParseException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_DATE", "Invalid " + name,
                    "ISO-8601 date-time with offset expected");
        }
    }
}
