package com.taildeck.backend.modules.rbac.presentation;

import java.util.Comparator;
import java.util.List;

import com.taildeck.backend.global.security.authorization.AuthenticatedContext;
import com.taildeck.backend.global.security.authorization.RequiresRoles;
import com.taildeck.backend.modules.rbac.domain.PermissionName;
import com.taildeck.backend.modules.rbac.domain.RoleHierarchy;
import com.taildeck.backend.modules.rbac.domain.RoleName;
import com.taildeck.backend.modules.rbac.domain.RolePermissionCatalog;
import com.taildeck.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.taildeck.backend.modules.rbac.presentation.dto.RoleResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Roles", description = "역할/권한 카탈로그")
public class RoleCatalogController {

    private final RoleRepository roleRepository;
    private final RoleHierarchy roleHierarchy;

    public RoleCatalogController(RoleRepository roleRepository, RoleHierarchy roleHierarchy) {
        this.roleRepository = roleRepository;
        this.roleHierarchy = roleHierarchy;
    }

    @GetMapping("/api/roles")
    @Operation(summary = "역할 목록", description = "roles:read 권한을 가진 역할만 조회할 수 있다")
    @RequiresRoles({RoleName.OWNER, RoleName.ADMIN, RoleName.AUDITOR})
    public ResponseEntity<List<RoleResponse>> list(AuthenticatedContext context) {
        List<RoleResponse> roles = roleRepository.findAllByOrderByHierarchyLevelDesc().stream()
                .flatMap(role -> RoleName.parse(role.getName()).stream()
                        .map(name -> new RoleResponse(
                                name.name(),
                                role.getDescription(),
                                role.getHierarchyLevel(),
                                role.isSystem(),
                                RolePermissionCatalog.permissionsOf(name).stream()
                                        .sorted(Comparator.comparing(PermissionName::value))
                                        .map(PermissionName::value)
                                        .toList(),
                                roleHierarchy.canAssignRole(context.roles(), name))))
                .toList();
        return ResponseEntity.ok(roles);
    }
}
