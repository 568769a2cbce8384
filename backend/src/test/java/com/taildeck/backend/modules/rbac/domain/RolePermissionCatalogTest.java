package com.taildeck.backend.modules.rbac.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.EnumSet;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RolePermissionCatalogTest {

    @Test
    @DisplayName("상위 역할의 권한은 하위 역할 권한의 상위집합이다")
    void higherRolesHoldSupersetOfLowerRolePermissions() {
        assertThat(RolePermissionCatalog.permissionsOf(RoleName.OWNER))
                .containsAll(RolePermissionCatalog.permissionsOf(RoleName.ADMIN));
        assertThat(RolePermissionCatalog.permissionsOf(RoleName.ADMIN))
                .containsAll(RolePermissionCatalog.permissionsOf(RoleName.OPERATOR));
        assertThat(RolePermissionCatalog.permissionsOf(RoleName.OPERATOR))
                .containsAll(RolePermissionCatalog.permissionsOf(RoleName.USER));
    }

    @Test
    void onlyOwnerCanWriteRoles() {
        for (RoleName role : RoleName.values()) {
            assertThat(RolePermissionCatalog.hasPermission(Set.of(role), PermissionName.ROLES_WRITE))
                    .as(role.name())
                    .isEqualTo(role == RoleName.OWNER);
        }
    }

    @Test
    @DisplayName("AUDITOR 권한은 모두 읽기 전용이다")
    void auditorIsReadOnly() {
        assertThat(RolePermissionCatalog.permissionsOf(RoleName.AUDITOR))
                .allMatch(PermissionName::isReadOnly)
                .contains(PermissionName.AUDIT_READ);
    }

    @Test
    void permissionsOfRoleSetIsUnion() {
        Set<PermissionName> union = RolePermissionCatalog.permissionsOf(EnumSet.of(RoleName.USER, RoleName.AUDITOR));

        assertThat(union).contains(PermissionName.KEYS_WRITE, PermissionName.AUDIT_READ, PermissionName.ACL_READ);
        assertThat(union).doesNotContain(PermissionName.NODES_WRITE);
        assertThat(RolePermissionCatalog.permissionsOf(Set.of())).isEmpty();
    }

    @Test
    void permissionValueRoundTripsThroughResourceAction() {
        assertThat(PermissionName.ACL_WRITE.value()).isEqualTo("acl:write");
        assertThat(PermissionName.fromValue("audit:read")).contains(PermissionName.AUDIT_READ);
        assertThat(PermissionName.fromValue("audit:write")).isEmpty();
    }
}
