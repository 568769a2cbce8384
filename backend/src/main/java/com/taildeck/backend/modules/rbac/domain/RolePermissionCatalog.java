package com.taildeck.backend.modules.rbac.domain;

import static com.taildeck.backend.modules.rbac.domain.PermissionName.*;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 역할별 권한 카탈로그. V2 시드 마이그레이션과 동일해야 하며 기동 시 {@code RoleCatalogValidator}가 비교한다.
 */
public final class RolePermissionCatalog {

    private static final Map<RoleName, Set<PermissionName>> PERMISSIONS;

    static {
        EnumMap<RoleName, Set<PermissionName>> map = new EnumMap<>(RoleName.class);
        map.put(RoleName.OWNER, EnumSet.allOf(PermissionName.class));
        map.put(RoleName.ADMIN, EnumSet.complementOf(EnumSet.of(ROLES_WRITE)));
        map.put(RoleName.OPERATOR, EnumSet.of(
                NODES_READ, NODES_WRITE,
                ROUTES_READ, ROUTES_WRITE,
                USERS_READ,
                KEYS_READ, KEYS_WRITE, KEYS_DELETE,
                AUDIT_READ,
                SETTINGS_READ));
        map.put(RoleName.AUDITOR, EnumSet.of(
                NODES_READ, ROUTES_READ, ACL_READ, USERS_READ, KEYS_READ, AUDIT_READ, SETTINGS_READ, ROLES_READ));
        map.put(RoleName.USER, EnumSet.of(NODES_READ, KEYS_READ, KEYS_WRITE));
        map.replaceAll((role, permissions) -> Collections.unmodifiableSet(permissions));
        PERMISSIONS = Collections.unmodifiableMap(map);
    }

    private RolePermissionCatalog() {
    }

    public static Set<PermissionName> permissionsOf(RoleName role) {
        return PERMISSIONS.get(role);
    }

    public static Set<PermissionName> permissionsOf(Set<RoleName> roles) {
        EnumSet<PermissionName> result = EnumSet.noneOf(PermissionName.class);
        if (roles != null) {
            roles.forEach(role -> result.addAll(PERMISSIONS.get(role)));
        }
        return Collections.unmodifiableSet(result);
    }

    public static boolean hasPermission(Set<RoleName> roles, PermissionName permission) {
        return permission != null && permissionsOf(roles).contains(permission);
    }

    public static Map<RoleName, Set<PermissionName>> asMap() {
        return PERMISSIONS;
    }
}
