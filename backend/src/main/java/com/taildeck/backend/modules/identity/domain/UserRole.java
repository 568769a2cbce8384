package com.taildeck.backend.modules.identity.domain;

import java.util.UUID;

import com.taildeck.backend.global.jpa.AbstractTimestampedEntity;
import com.taildeck.backend.modules.rbac.domain.RoleName;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * 사용자-역할 매핑 엔터티. (user_id, role_name)은 유일하다.
 */
@Entity
@Table(name = "user_role", uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "role_name"}))
public class UserRole extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private AppUser user;

    @Enumerated(EnumType.STRING)
    @Column(name = "role_name", nullable = false, length = 32)
    private RoleName roleName;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 16)
    private RoleSource source;

    @Column(name = "granted_by")
    private UUID grantedBy;

    protected UserRole() {
    }

    public UserRole(AppUser user, RoleName roleName, RoleSource source, UUID grantedBy) {
        this.user = user;
        this.roleName = roleName;
        this.source = source;
        this.grantedBy = grantedBy;
    }

    public UUID getId() {
        return id;
    }

    public AppUser getUser() {
        return user;
    }

    public RoleName getRoleName() {
        return roleName;
    }

    public RoleSource getSource() {
        return source;
    }

    public UUID getGrantedBy() {
        return grantedBy;
    }
}
