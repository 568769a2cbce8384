package com.taildeck.backend.global.security.authorization;

import java.util.Set;

import com.taildeck.backend.modules.auth.application.SessionClaims;
import com.taildeck.backend.modules.rbac.domain.RoleHierarchy;
import com.taildeck.backend.modules.rbac.domain.RoleName;

import org.springframework.stereotype.Component;

/**
 * 세션 클레임과 역할 요구사항만으로 접근 여부를 판정한다. 부수효과가 없다.
 */
@Component
public class AccessDecisionService {

    private final RoleHierarchy roleHierarchy;

    public AccessDecisionService(RoleHierarchy roleHierarchy) {
        this.roleHierarchy = roleHierarchy;
    }

    public AccessDecision decide(SessionClaims claims, RoleRequirement requirement) {
        if (claims == null) {
            return AccessDecision.unauthenticated();
        }
        Set<RoleName> roles = claims.roles();
        return switch (requirement.mode()) {
            case AUTHENTICATED -> AccessDecision.allow();
            case ANY_OF -> roleHierarchy.hasAnyRole(roles, requirement.anyOf())
                    ? AccessDecision.allow()
                    : AccessDecision.forbiddenAnyOf(requirement.anyOf().stream().map(Enum::name).toList());
            case MINIMUM -> roleHierarchy.meetsMinimumRole(roles, requirement.minimum())
                    ? AccessDecision.allow()
                    : AccessDecision.forbiddenBelow(requirement.minimum().name());
        };
    }
}
