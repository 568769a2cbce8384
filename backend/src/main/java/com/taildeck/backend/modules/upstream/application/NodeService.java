package com.taildeck.backend.modules.upstream.application;

import java.util.ArrayList;
import java.util.List;

import com.taildeck.backend.global.error.AccessForbiddenException;
import com.taildeck.backend.global.error.ProblemException;
import com.taildeck.backend.global.security.authorization.AuthenticatedContext;
import com.taildeck.backend.modules.audit.application.AuditActor;
import com.taildeck.backend.modules.audit.application.AuditEntry;
import com.taildeck.backend.modules.audit.application.AuditLogService;
import com.taildeck.backend.modules.audit.domain.AuditAction;
import com.taildeck.backend.modules.audit.domain.AuditResourceType;
import com.taildeck.backend.modules.rbac.domain.RoleHierarchy;
import com.taildeck.backend.modules.upstream.client.GatewayResult;
import com.taildeck.backend.modules.upstream.client.UpstreamClient;
import com.taildeck.backend.modules.upstream.client.dto.UpstreamNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
public class NodeService {

    private static final Logger log = LoggerFactory.getLogger(NodeService.class);

    static final String RESOURCE = "Node";
    static final String TAG_PREFIX = "tag:";

    private final UpstreamClient upstreamClient;
    private final AuditLogService auditLogService;
    private final GatewayErrorTranslator errorTranslator;
    private final RoleHierarchy roleHierarchy;

    public NodeService(
            UpstreamClient upstreamClient,
            AuditLogService auditLogService,
            GatewayErrorTranslator errorTranslator,
            RoleHierarchy roleHierarchy
    ) {
        this.upstreamClient = upstreamClient;
        this.auditLogService = auditLogService;
        this.errorTranslator = errorTranslator;
        this.roleHierarchy = roleHierarchy;
    }

    public List<UpstreamNode> listNodes() {
        return unwrap(upstreamClient.listNodes());
    }

    public UpstreamNode getNode(String nodeId) {
        return unwrap(upstreamClient.getNode(nodeId));
    }

    /**
     * 이름, 태그, 소유 사용자 변경을 순서대로 적용한다. 변경마다 감사 항목을 하나씩 남긴다.
     */
    public UpstreamNode updateNode(AuthenticatedContext context, String nodeId, UpdateNodeCommand command) {
        if (command.tags() != null) {
            validateTags(command.tags());
        }
        UpstreamNode current = getNode(nodeId);
        UpstreamNode updated = current;
        AuditActor actor = AuditActor.from(context);

        if (command.givenName() != null) {
            updated = unwrap(upstreamClient.renameNode(nodeId, command.givenName()));
            auditLogService.logAudit(AuditEntry.of(AuditAction.RENAME_NODE, actor, AuditResourceType.NODE, nodeId)
                    .withOldValue(AuditValues.of("givenName", current.givenName()))
                    .withNewValue(AuditValues.of("givenName", command.givenName())));
            log.info("Node {} renamed to {} by {}", nodeId, command.givenName(), context.userId());
        }
        if (command.tags() != null) {
            updated = unwrap(upstreamClient.setNodeTags(nodeId, command.tags()));
            auditLogService.logAudit(AuditEntry.of(AuditAction.UPDATE_TAGS, actor, AuditResourceType.NODE, nodeId)
                    .withOldValue(AuditValues.of("tags", current.forcedTags()))
                    .withNewValue(AuditValues.of("tags", command.tags())));
            log.info("Node {} tags updated by {}", nodeId, context.userId());
        }
        if (command.user() != null) {
            updated = unwrap(upstreamClient.moveNode(nodeId, command.user()));
            auditLogService.logAudit(AuditEntry.of(AuditAction.MOVE_NODE, actor, AuditResourceType.NODE, nodeId)
                    .withOldValue(AuditValues.of("user", current.userName()))
                    .withNewValue(AuditValues.of("user", command.user())));
            log.info("Node {} moved to user {} by {}", nodeId, command.user(), context.userId());
        }
        return updated;
    }

    public UpstreamNode expireNode(AuthenticatedContext context, String nodeId) {
        UpstreamNode current = getNode(nodeId);
        UpstreamNode expired = unwrap(upstreamClient.expireNode(nodeId));
        auditLogService.logAudit(
                AuditEntry.of(AuditAction.EXPIRE_NODE, AuditActor.from(context), AuditResourceType.NODE, nodeId)
                        .withMetadata(AuditValues.of("nodeName", current.displayName())));
        log.info("Node {} expired by {}", nodeId, context.userId());
        return expired;
    }

    public void deleteNode(AuthenticatedContext context, String nodeId) {
        UpstreamNode current = getNode(nodeId);
        unwrap(upstreamClient.deleteNode(nodeId));
        auditLogService.logAudit(
                AuditEntry.of(AuditAction.DELETE_NODE, AuditActor.from(context), AuditResourceType.NODE, nodeId)
                        .withOldValue(current)
                        .withMetadata(AuditValues.of("nodeName", current.displayName())));
        log.info("Node {} deleted by {}", nodeId, context.userId());
    }

    public BulkNodeOutcome bulk(AuthenticatedContext context, BulkNodeCommand command) {
        BulkNodeAction action = command.action();
        if (!roleHierarchy.meetsMinimumRole(context.roles(), action.minimumRole())) {
            log.info("Bulk {} denied for user {} holding {}", action.value(), context.userId(), context.roles());
            throw AccessForbiddenException.requiringLevel(action.minimumRole().name());
        }
        validateBulk(command);

        List<BulkNodeOutcome.NodeResult> results = new ArrayList<>();
        for (String nodeId : command.nodeIds()) {
            GatewayResult<?> result = apply(command, nodeId);
            results.add(result.isSuccess()
                    ? BulkNodeOutcome.NodeResult.succeeded(nodeId)
                    : BulkNodeOutcome.NodeResult.failed(nodeId, errorTranslator.describe(result.error())));
        }

        int succeeded = (int) results.stream().filter(BulkNodeOutcome.NodeResult::success).count();
        BulkNodeOutcome outcome = new BulkNodeOutcome(action.value(), List.copyOf(results),
                new BulkNodeOutcome.Summary(results.size(), succeeded, results.size() - succeeded));

        if (succeeded > 0) {
            auditLogService.logAudit(AuditEntry.of(action.auditAction(), AuditActor.from(context),
                            AuditResourceType.NODE, String.join(",", outcome.succeededIds()))
                    .withNewValue(bulkNewValue(command))
                    .withMetadata(AuditValues.of(
                            "total", outcome.summary().total(),
                            "succeeded", outcome.summary().succeeded(),
                            "failed", outcome.summary().failed())));
        }
        log.info("Bulk {} by {}: {} succeeded, {} failed",
                action.value(), context.userId(), succeeded, results.size() - succeeded);
        return outcome;
    }

    private GatewayResult<?> apply(BulkNodeCommand command, String nodeId) {
        return switch (command.action()) {
            case DELETE -> upstreamClient.deleteNode(nodeId);
            case EXPIRE -> upstreamClient.expireNode(nodeId);
            case MOVE -> upstreamClient.moveNode(nodeId, command.newUser());
            case TAGS -> upstreamClient.setNodeTags(nodeId, command.tags());
        };
    }

    private static Object bulkNewValue(BulkNodeCommand command) {
        return switch (command.action()) {
            case MOVE -> AuditValues.of("user", command.newUser());
            case TAGS -> AuditValues.of("tags", command.tags());
            case DELETE, EXPIRE -> null;
        };
    }

    private static void validateBulk(BulkNodeCommand command) {
        if (command.nodeIds().isEmpty() || command.nodeIds().size() > BulkNodeCommand.MAX_NODES) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Invalid request",
                    "nodeIds must contain between 1 and " + BulkNodeCommand.MAX_NODES + " entries");
        }
        if (command.action() == BulkNodeAction.MOVE && (command.newUser() == null || command.newUser().isBlank())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Invalid request",
                    "newUser is required for move action");
        }
        if (command.action() == BulkNodeAction.TAGS) {
            if (command.tags() == null) {
                throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Invalid request",
                        "tags is required for tags action");
            }
            validateTags(command.tags());
        }
    }

    private static void validateTags(List<String> tags) {
        for (String tag : tags) {
            if (tag == null || !tag.startsWith(TAG_PREFIX) || tag.length() == TAG_PREFIX.length()) {
                throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_TAG", "Invalid request",
                        "Tags must start with '" + TAG_PREFIX + "': " + tag);
            }
        }
    }

    private <T> T unwrap(GatewayResult<T> result) {
        return result.orElseThrow(error -> errorTranslator.translate(error, RESOURCE));
    }
}
