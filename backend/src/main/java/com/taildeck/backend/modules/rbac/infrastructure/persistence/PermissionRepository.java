package com.taildeck.backend.modules.rbac.infrastructure.persistence;

import com.taildeck.backend.modules.rbac.domain.Permission;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PermissionRepository extends JpaRepository<Permission, String> {
}
