package com.taildeck.backend.modules.rbac.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.taildeck.backend.modules.rbac.domain.Role;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleRepository extends JpaRepository<Role, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Role r where r.name = :name")
    Optional<Role> findByNameForUpdate(@Param("name") String name);

    List<Role> findAllByOrderByHierarchyLevelDesc();
}
