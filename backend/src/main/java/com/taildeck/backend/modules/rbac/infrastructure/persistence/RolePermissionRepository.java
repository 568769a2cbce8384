package com.taildeck.backend.modules.rbac.infrastructure.persistence;

import com.taildeck.backend.modules.rbac.domain.RolePermission;
import com.taildeck.backend.modules.rbac.domain.RolePermissionId;

import org.springframework.data.jpa.repository.JpaRepository;

public interface RolePermissionRepository extends JpaRepository<RolePermission, RolePermissionId> {
}
