package com.taildeck.backend.modules.identity.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.taildeck.backend.modules.identity.domain.AppUser;
import com.taildeck.backend.modules.identity.domain.ExternalIdentity;
import com.taildeck.backend.modules.identity.domain.GroupRoleMapping;
import com.taildeck.backend.modules.identity.domain.RoleSource;
import com.taildeck.backend.modules.identity.domain.UserRole;
import com.taildeck.backend.modules.identity.infrastructure.persistence.AppUserRepository;
import com.taildeck.backend.modules.identity.infrastructure.persistence.UserRoleRepository;
import com.taildeck.backend.modules.rbac.domain.RoleHierarchy;
import com.taildeck.backend.modules.rbac.domain.RoleName;
import com.taildeck.backend.modules.rbac.infrastructure.persistence.RoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * ID 제공자 그룹을 로컬 역할로 동기화하고 최초 로그인 사용자를 소유자로 지정한다.
 */
@Service
public class IdentitySyncService {

    private static final Logger log = LoggerFactory.getLogger(IdentitySyncService.class);

    private final AppUserRepository appUserRepository;
    private final UserRoleRepository userRoleRepository;
    private final RoleRepository roleRepository;
    private final RoleHierarchy roleHierarchy;
    private final Clock clock;

    public IdentitySyncService(
            AppUserRepository appUserRepository,
            UserRoleRepository userRoleRepository,
            RoleRepository roleRepository,
            RoleHierarchy roleHierarchy,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.userRoleRepository = userRoleRepository;
        this.roleRepository = roleRepository;
        this.roleHierarchy = roleHierarchy;
        this.clock = clock;
    }

    /**
     * 사용자를 upsert하고 OIDC 출처 역할을 매핑 결과로 교체한다. DATABASE 출처 역할은 건드리지 않는다.
     * 같은 입력으로 반복 호출해도 결과가 같다.
     */
    @Transactional
    public UUID syncRoles(ExternalIdentity identity) {
        AppUser user = appUserRepository.findBySubject(identity.subject())
                .orElseGet(() -> new AppUser(identity.subject()));
        user.updateProfile(identity.email(), identity.name());
        user = appUserRepository.save(user);

        Set<RoleName> mapped = GroupRoleMapping.rolesFor(identity.groups());
        List<UserRole> current = userRoleRepository.findByUserId(user.getId());

        Set<RoleName> held = EnumSet.noneOf(RoleName.class);
        for (UserRole userRole : current) {
            if (userRole.getSource() == RoleSource.OIDC && !mapped.contains(userRole.getRoleName())) {
                userRoleRepository.delete(userRole);
            } else {
                held.add(userRole.getRoleName());
            }
        }
        for (RoleName role : mapped) {
            if (!held.contains(role)) {
                userRoleRepository.save(new UserRole(user, role, RoleSource.OIDC, null));
            }
        }

        log.debug("Synced roles for subject={} groups={} mapped={}", identity.subject(), identity.groups(), mapped);
        return user.getId();
    }

    /**
     * 소유자가 아직 없으면 이 사용자에게 소유자 역할을 부여한다.
     * 소유자 역할 행에 비관적 잠금을 건 뒤 조건부 insert 한 번으로 처리하므로 동시 로그인에서도 소유자는 한 명이다.
     *
     * @return 이번 호출로 소유자가 지정되었으면 true
     */
    @Transactional
    public boolean ensureOwnerExists(UUID userId) {
        RoleName owner = roleHierarchy.highest();
        roleRepository.findByNameForUpdate(owner.name())
                .orElseThrow(() -> new IllegalStateException("Role " + owner + " is not seeded"));

        int inserted = userRoleRepository.insertIfNoHolder(
                UUID.randomUUID(),
                userId,
                owner.name(),
                RoleSource.DATABASE.name(),
                OffsetDateTime.now(clock)
        );
        if (inserted == 1) {
            log.info("Bootstrapped first user {} as {}", userId, owner);
            return true;
        }
        return false;
    }

    @Transactional(readOnly = true)
    public Set<RoleName> currentRoles(UUID userId) {
        Set<RoleName> roles = EnumSet.noneOf(RoleName.class);
        userRoleRepository.findByUserId(userId).forEach(userRole -> roles.add(userRole.getRoleName()));
        return roles;
    }
}
