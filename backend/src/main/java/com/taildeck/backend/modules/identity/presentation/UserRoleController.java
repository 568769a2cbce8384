package com.taildeck.backend.modules.identity.presentation;

import java.util.UUID;

import com.taildeck.backend.global.error.InvalidParameterException;
import com.taildeck.backend.global.security.authorization.AuthenticatedContext;
import com.taildeck.backend.global.security.authorization.RequiresMinimumRole;
import com.taildeck.backend.modules.identity.application.RoleAdministrationService;
import com.taildeck.backend.modules.identity.presentation.dto.AssignRoleRequest;
import com.taildeck.backend.modules.identity.presentation.dto.UserRolesResponse;
import com.taildeck.backend.modules.rbac.domain.RoleName;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users/{userId}/roles")
@Tag(name = "User roles", description = "로컬 사용자 역할 관리")
@RequiresMinimumRole(RoleName.ADMIN)
public class UserRoleController {

    private final RoleAdministrationService roleAdministrationService;

    public UserRoleController(RoleAdministrationService roleAdministrationService) {
        this.roleAdministrationService = roleAdministrationService;
    }

    @GetMapping
    @Operation(summary = "사용자 역할 조회")
    public ResponseEntity<UserRolesResponse> list(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(roleAdministrationService.effectiveRoles(userId));
    }

    @PostMapping
    @Operation(summary = "역할 부여", description = "OWNER는 모든 역할을, ADMIN은 OWNER를 제외한 역할을 부여할 수 있다")
    public ResponseEntity<UserRolesResponse> assign(
            AuthenticatedContext context,
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody AssignRoleRequest request
    ) {
        RoleName role = parseRole(request.role());
        return ResponseEntity.ok(roleAdministrationService.assignRole(context, userId, role));
    }

    @DeleteMapping("/{roleName}")
    @Operation(summary = "역할 회수")
    public ResponseEntity<UserRolesResponse> remove(
            AuthenticatedContext context,
            @PathVariable("userId") UUID userId,
            @PathVariable("roleName") String roleName
    ) {
        return ResponseEntity.ok(roleAdministrationService.removeRole(context, userId, parseRole(roleName)));
    }

    private RoleName parseRole(String raw) {
        return RoleName.parse(raw).orElseThrow(() -> new InvalidParameterException("role", RoleName.names()));
    }
}
