package com.taildeck.backend.modules.upstream.presentation;

import com.taildeck.backend.global.error.InvalidParameterException;
import com.taildeck.backend.global.security.authorization.AuthenticatedContext;
import com.taildeck.backend.global.security.authorization.RequiresMinimumRole;
import com.taildeck.backend.modules.rbac.domain.RoleName;
import com.taildeck.backend.modules.upstream.application.BulkNodeAction;
import com.taildeck.backend.modules.upstream.application.BulkNodeCommand;
import com.taildeck.backend.modules.upstream.application.BulkNodeOutcome;
import com.taildeck.backend.modules.upstream.application.NodeService;
import com.taildeck.backend.modules.upstream.client.dto.NodeListResponse;
import com.taildeck.backend.modules.upstream.client.dto.NodeResponse;
import com.taildeck.backend.modules.upstream.presentation.dto.BulkNodeRequest;
import com.taildeck.backend.modules.upstream.presentation.dto.OperationResultResponse;
import com.taildeck.backend.modules.upstream.presentation.dto.UpdateNodeRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/headscale/nodes")
@Tag(name = "Nodes", description = "Headscale 노드 관리")
public class NodeController {

    private final NodeService nodeService;

    public NodeController(NodeService nodeService) {
        this.nodeService = nodeService;
    }

    @GetMapping
    @RequiresMinimumRole(RoleName.USER)
    @Operation(summary = "노드 목록 조회")
    public ResponseEntity<NodeListResponse> list() {
        return ResponseEntity.ok(new NodeListResponse(nodeService.listNodes()));
    }

    @GetMapping("/{id}")
    @RequiresMinimumRole(RoleName.USER)
    @Operation(summary = "노드 상세 조회")
    public ResponseEntity<NodeResponse> get(@PathVariable("id") String id) {
        return ResponseEntity.ok(new NodeResponse(nodeService.getNode(id)));
    }

    @PatchMapping("/{id}")
    @RequiresMinimumRole(RoleName.OPERATOR)
    @Operation(summary = "노드 수정", description = "이름, 태그, 소유 사용자를 변경한다")
    public ResponseEntity<NodeResponse> update(
            AuthenticatedContext context,
            @PathVariable("id") String id,
            @Valid @RequestBody UpdateNodeRequest request
    ) {
        return ResponseEntity.ok(new NodeResponse(nodeService.updateNode(context, id, request.toCommand())));
    }

    @PostMapping("/{id}/expire")
    @RequiresMinimumRole(RoleName.OPERATOR)
    @Operation(summary = "노드 만료")
    public ResponseEntity<NodeResponse> expire(AuthenticatedContext context, @PathVariable("id") String id) {
        return ResponseEntity.ok(new NodeResponse(nodeService.expireNode(context, id)));
    }

    @DeleteMapping("/{id}")
    @RequiresMinimumRole(RoleName.ADMIN)
    @Operation(summary = "노드 삭제")
    public ResponseEntity<OperationResultResponse> delete(AuthenticatedContext context, @PathVariable("id") String id) {
        nodeService.deleteNode(context, id);
        return ResponseEntity.ok(OperationResultResponse.ok());
    }

    @PostMapping("/bulk")
    @RequiresMinimumRole(RoleName.OPERATOR)
    @Operation(summary = "노드 일괄 작업", description = "delete 는 ADMIN 이상만 가능하다")
    public ResponseEntity<BulkNodeOutcome> bulk(
            AuthenticatedContext context,
            @Valid @RequestBody BulkNodeRequest request
    ) {
        BulkNodeAction action = BulkNodeAction.parse(request.action())
                .orElseThrow(() -> new InvalidParameterException("action", BulkNodeAction.valuesAsText()));
        BulkNodeCommand command = new BulkNodeCommand(action, request.nodeIds(), request.newUser(), request.tags());
        return ResponseEntity.ok(nodeService.bulk(context, command));
    }
}
