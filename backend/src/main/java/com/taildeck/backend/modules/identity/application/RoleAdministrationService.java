package com.taildeck.backend.modules.identity.application;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.taildeck.backend.global.error.AccessForbiddenException;
import com.taildeck.backend.global.error.ProblemException;
import com.taildeck.backend.global.security.authorization.AuthenticatedContext;
import com.taildeck.backend.modules.audit.application.AuditActor;
import com.taildeck.backend.modules.audit.application.AuditEntry;
import com.taildeck.backend.modules.audit.application.AuditLogService;
import com.taildeck.backend.modules.audit.domain.AuditAction;
import com.taildeck.backend.modules.audit.domain.AuditResourceType;
import com.taildeck.backend.modules.identity.domain.AppUser;
import com.taildeck.backend.modules.identity.domain.RoleSource;
import com.taildeck.backend.modules.identity.domain.UserRole;
import com.taildeck.backend.modules.identity.infrastructure.persistence.AppUserRepository;
import com.taildeck.backend.modules.identity.infrastructure.persistence.UserRoleRepository;
import com.taildeck.backend.modules.identity.presentation.dto.UserRoleResponse;
import com.taildeck.backend.modules.identity.presentation.dto.UserRolesResponse;
import com.taildeck.backend.modules.rbac.domain.RoleHierarchy;
import com.taildeck.backend.modules.rbac.domain.RoleName;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 관리자의 DATABASE 출처 역할 부여/회수. 변경이 커밋된 뒤에 감사 로그를 남긴다.
 */
@Service
public class RoleAdministrationService {

    private static final Logger log = LoggerFactory.getLogger(RoleAdministrationService.class);

    private final AppUserRepository appUserRepository;
    private final UserRoleRepository userRoleRepository;
    private final RoleHierarchy roleHierarchy;
    private final AuditLogService auditLogService;
    private final TransactionTemplate transactionTemplate;

    public RoleAdministrationService(
            AppUserRepository appUserRepository,
            UserRoleRepository userRoleRepository,
            RoleHierarchy roleHierarchy,
            AuditLogService auditLogService,
            PlatformTransactionManager transactionManager
    ) {
        this.appUserRepository = appUserRepository;
        this.userRoleRepository = userRoleRepository;
        this.roleHierarchy = roleHierarchy;
        this.auditLogService = auditLogService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public UserRolesResponse assignRole(AuthenticatedContext actor, UUID userId, RoleName role) {
        ensureCanAssign(actor, role);
        AppUser target = transactionTemplate.execute(status -> {
            AppUser user = findUser(userId);
            boolean alreadyHeld = userRoleRepository.findByUserId(userId).stream()
                    .anyMatch(userRole -> userRole.getRoleName() == role);
            if (alreadyHeld) {
                throw new ProblemException(HttpStatus.CONFLICT, "ROLE_ALREADY_ASSIGNED", "Role already assigned");
            }
            userRoleRepository.save(new UserRole(user, role, RoleSource.DATABASE, actor.userId()));
            return user;
        });

        log.info("Role {} assigned to user {} by {}", role, userId, actor.userId());
        auditLogService.logAudit(roleEntry(AuditAction.ASSIGN_ROLE, actor, role, target));
        return effectiveRoles(userId);
    }

    public UserRolesResponse removeRole(AuthenticatedContext actor, UUID userId, RoleName role) {
        ensureCanAssign(actor, role);
        AppUser target = transactionTemplate.execute(status -> {
            AppUser user = findUser(userId);
            List<UserRole> current = userRoleRepository.findByUserId(userId);
            Optional<UserRole> assigned = current.stream()
                    .filter(userRole -> userRole.getRoleName() == role)
                    .findFirst();
            if (assigned.isEmpty()) {
                throw new ProblemException(HttpStatus.NOT_FOUND, "ROLE_NOT_ASSIGNED", "Role not assigned");
            }
            if (assigned.get().getSource() != RoleSource.DATABASE) {
                throw new ProblemException(HttpStatus.CONFLICT, "ROLE_MANAGED_BY_IDENTITY_PROVIDER",
                        "Role is managed by identity provider groups");
            }
            if (role == roleHierarchy.highest() && userRoleRepository.countByRoleName(role) <= 1) {
                throw new ProblemException(HttpStatus.CONFLICT, "LAST_OWNER", "Cannot remove the last owner");
            }
            userRoleRepository.delete(assigned.get());
            return user;
        });

        log.info("Role {} removed from user {} by {}", role, userId, actor.userId());
        auditLogService.logAudit(roleEntry(AuditAction.REMOVE_ROLE, actor, role, target));
        return effectiveRoles(userId);
    }

    public UserRolesResponse effectiveRoles(UUID userId) {
        return transactionTemplate.execute(status -> {
            AppUser user = findUser(userId);
            List<UserRoleResponse> roles = userRoleRepository.findByUserId(userId).stream()
                    .sorted(Comparator.comparingInt((UserRole userRole) -> roleHierarchy.levelOf(userRole.getRoleName()))
                            .reversed())
                    .map(userRole -> new UserRoleResponse(
                            userRole.getRoleName().name(),
                            userRole.getSource().name(),
                            userRole.getGrantedBy(),
                            userRole.getCreatedAt()))
                    .toList();
            String effective = roles.isEmpty() ? null : roles.get(0).role();
            return new UserRolesResponse(user.getId(), user.getEmail(), user.getName(), effective, roles);
        });
    }

    private void ensureCanAssign(AuthenticatedContext actor, RoleName role) {
        if (!roleHierarchy.canAssignRole(actor.roles(), role)) {
            throw AccessForbiddenException.withMessage("You cannot manage the " + role + " role");
        }
    }

    private AppUser findUser(UUID userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "User not found"));
    }

    private AuditEntry roleEntry(AuditAction action, AuthenticatedContext actor, RoleName role, AppUser target) {
        return AuditEntry.of(action, AuditActor.from(actor), AuditResourceType.ROLE, role.name())
                .withMetadata(Map.of(
                        "targetUserId", target.getId().toString(),
                        "targetUserEmail", target.getEmail() == null ? "" : target.getEmail()
                ));
    }
}
