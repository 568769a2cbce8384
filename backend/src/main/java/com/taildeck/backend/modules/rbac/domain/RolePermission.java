package com.taildeck.backend.modules.rbac.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

@Entity
@Table(name = "role_permission")
public class RolePermission {

    @EmbeddedId
    private RolePermissionId id;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected RolePermission() {
    }

    public RolePermissionId getId() {
        return id;
    }

    public String getRoleName() {
        return id.getRoleName();
    }

    public String getPermissionName() {
        return id.getPermissionName();
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
