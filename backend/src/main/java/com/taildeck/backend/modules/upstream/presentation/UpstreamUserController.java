package com.taildeck.backend.modules.upstream.presentation;

import com.taildeck.backend.global.security.authorization.AuthenticatedContext;
import com.taildeck.backend.global.security.authorization.RequiresRoles;
import com.taildeck.backend.modules.rbac.domain.RoleName;
import com.taildeck.backend.modules.upstream.application.UpstreamUserService;
import com.taildeck.backend.modules.upstream.client.dto.UserListResponse;
import com.taildeck.backend.modules.upstream.client.dto.UserResponse;
import com.taildeck.backend.modules.upstream.presentation.dto.CreateUpstreamUserRequest;
import com.taildeck.backend.modules.upstream.presentation.dto.OperationResultResponse;
import com.taildeck.backend.modules.upstream.presentation.dto.RenameUpstreamUserRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/headscale/users")
@Tag(name = "Headscale users", description = "Headscale 사용자 관리")
@RequiresRoles({RoleName.ADMIN, RoleName.OWNER})
public class UpstreamUserController {

    private final UpstreamUserService upstreamUserService;

    public UpstreamUserController(UpstreamUserService upstreamUserService) {
        this.upstreamUserService = upstreamUserService;
    }

    @GetMapping
    @RequiresRoles({RoleName.OPERATOR, RoleName.ADMIN, RoleName.OWNER})
    @Operation(summary = "Headscale 사용자 목록 조회")
    public ResponseEntity<UserListResponse> list() {
        return ResponseEntity.ok(new UserListResponse(upstreamUserService.listUsers()));
    }

    @PostMapping
    @Operation(summary = "Headscale 사용자 생성")
    public ResponseEntity<UserResponse> create(
            AuthenticatedContext context,
            @Valid @RequestBody CreateUpstreamUserRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new UserResponse(upstreamUserService.createUser(context, request.name())));
    }

    @PostMapping("/{name}/rename")
    @Operation(summary = "Headscale 사용자 이름 변경")
    public ResponseEntity<UserResponse> rename(
            AuthenticatedContext context,
            @PathVariable("name") String name,
            @Valid @RequestBody RenameUpstreamUserRequest request
    ) {
        return ResponseEntity.ok(new UserResponse(upstreamUserService.renameUser(context, name, request.newName())));
    }

    @DeleteMapping("/{name}")
    @Operation(summary = "Headscale 사용자 삭제")
    public ResponseEntity<OperationResultResponse> delete(AuthenticatedContext context,
                                                          @PathVariable("name") String name) {
        upstreamUserService.deleteUser(context, name);
        return ResponseEntity.ok(OperationResultResponse.ok());
    }
}
