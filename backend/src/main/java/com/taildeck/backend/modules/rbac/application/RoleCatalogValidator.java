package com.taildeck.backend.modules.rbac.application;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.taildeck.backend.modules.rbac.domain.Permission;
import com.taildeck.backend.modules.rbac.domain.PermissionName;
import com.taildeck.backend.modules.rbac.domain.Role;
import com.taildeck.backend.modules.rbac.domain.RoleName;
import com.taildeck.backend.modules.rbac.domain.RolePermission;
import com.taildeck.backend.modules.rbac.domain.RolePermissionCatalog;
import com.taildeck.backend.modules.rbac.infrastructure.persistence.PermissionRepository;
import com.taildeck.backend.modules.rbac.infrastructure.persistence.RolePermissionRepository;
import com.taildeck.backend.modules.rbac.infrastructure.persistence.RoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 저장소의 role/permission/role_permission 행이 코드의 역할 카탈로그와 일치하는지 기동 시점에 검증한다.
 * 불일치가 하나라도 있으면 기동을 중단한다.
 */
@Component
public class RoleCatalogValidator {

    private static final Logger log = LoggerFactory.getLogger(RoleCatalogValidator.class);

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final RolePermissionRepository rolePermissionRepository;

    public RoleCatalogValidator(
            RoleRepository roleRepository,
            PermissionRepository permissionRepository,
            RolePermissionRepository rolePermissionRepository
    ) {
        this.roleRepository = roleRepository;
        this.permissionRepository = permissionRepository;
        this.rolePermissionRepository = rolePermissionRepository;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Transactional(readOnly = true)
    public void validateOnStartup() {
        List<String> problems = findMismatches();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Role catalog mismatch: {}", problem));
            throw new IllegalStateException("Role catalog does not match the database: " + problems);
        }
        log.info("Role catalog verified ({} roles, {} permissions)",
                RoleName.values().length, PermissionName.values().length);
    }

    @Transactional(readOnly = true)
    public List<String> findMismatches() {
        List<String> problems = new ArrayList<>();

        Set<RoleName> seenRoles = EnumSet.noneOf(RoleName.class);
        for (Role role : roleRepository.findAll()) {
            RoleName.parse(role.getName()).ifPresentOrElse(known -> {
                seenRoles.add(known);
                if (known.level() != role.getHierarchyLevel()) {
                    problems.add("role " + known + " has level " + role.getHierarchyLevel()
                            + " but expected " + known.level());
                }
                if (!role.isSystem()) {
                    problems.add("role " + known + " is not flagged as a system role");
                }
            }, () -> problems.add("unknown role " + role.getName()));
        }
        for (RoleName role : RoleName.values()) {
            if (!seenRoles.contains(role)) {
                problems.add("missing role " + role);
            }
        }

        Set<PermissionName> seenPermissions = EnumSet.noneOf(PermissionName.class);
        for (Permission permission : permissionRepository.findAll()) {
            PermissionName.fromValue(permission.getName()).ifPresentOrElse(known -> {
                seenPermissions.add(known);
                if (!known.resource().equals(permission.getResource()) || !known.action().equals(permission.getAction())) {
                    problems.add("permission " + known.value() + " has mismatched resource/action");
                }
            }, () -> problems.add("unknown permission " + permission.getName()));
        }
        for (PermissionName permission : PermissionName.values()) {
            if (!seenPermissions.contains(permission)) {
                problems.add("missing permission " + permission.value());
            }
        }

        Map<RoleName, Set<PermissionName>> stored = new EnumMap<>(RoleName.class);
        for (RoleName role : RoleName.values()) {
            stored.put(role, EnumSet.noneOf(PermissionName.class));
        }
        for (RolePermission grant : rolePermissionRepository.findAll()) {
            var role = RoleName.parse(grant.getRoleName());
            var permission = PermissionName.fromValue(grant.getPermissionName());
            if (role.isEmpty() || permission.isEmpty()) {
                problems.add("unknown grant " + grant.getRoleName() + " -> " + grant.getPermissionName());
                continue;
            }
            stored.get(role.get()).add(permission.get());
        }
        RolePermissionCatalog.asMap().forEach((role, expected) -> {
            if (!stored.get(role).equals(expected)) {
                problems.add("permissions of " + role + " are " + stored.get(role) + " but expected " + expected);
            }
        });
        return problems;
    }
}
