package com.taildeck.backend.global.security.authorization;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.taildeck.backend.modules.rbac.domain.RoleName;

/**
 * 인가를 통과한 요청의 호출자 정보. 핸들러 파라미터로 주입된다.
 */
public record AuthenticatedContext(
        UUID userId,
        String email,
        String name,
        Set<RoleName> roles,
        Map<String, String> pathVariables,
        String clientIp
) {

    public static final String REQUEST_ATTRIBUTE = AuthenticatedContext.class.getName();

    public AuthenticatedContext {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        pathVariables = pathVariables == null ? Map.of() : Map.copyOf(pathVariables);
    }

    public boolean hasRole(RoleName role) {
        return roles.contains(role);
    }

    public String pathVariable(String name) {
        return pathVariables.get(name);
    }
}
