package com.taildeck.backend.modules.rbac.domain;

import com.taildeck.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * 역할 정의 엔터티. 시스템 역할은 시드 마이그레이션으로만 생성된다.
 */
@Entity
@Table(name = "role")
public class Role extends AbstractTimestampedEntity {

    @Id
    @Column(name = "name", nullable = false, length = 32)
    private String name;

    @Column(name = "description", length = 255)
    private String description;

    @Column(name = "is_system", nullable = false)
    private boolean system;

    @Column(name = "hierarchy_level", nullable = false, unique = true)
    private int hierarchyLevel;

    protected Role() {
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public boolean isSystem() {
        return system;
    }

    public int getHierarchyLevel() {
        return hierarchyLevel;
    }
}
