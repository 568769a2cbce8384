package com.taildeck.backend.modules.rbac.domain;

import java.io.Serializable;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class RolePermissionId implements Serializable {

    @Column(name = "role_name", nullable = false, length = 32)
    private String roleName;

    @Column(name = "permission_name", nullable = false, length = 64)
    private String permissionName;

    protected RolePermissionId() {
    }

    public RolePermissionId(String roleName, String permissionName) {
        this.roleName = roleName;
        this.permissionName = permissionName;
    }

    public String getRoleName() {
        return roleName;
    }

    public String getPermissionName() {
        return permissionName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RolePermissionId that)) {
            return false;
        }
        return Objects.equals(roleName, that.roleName) && Objects.equals(permissionName, that.permissionName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(roleName, permissionName);
    }
}
