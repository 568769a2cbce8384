package com.taildeck.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

import com.taildeck.backend.modules.rbac.domain.RoleName;

/**
 * 서명된 액세스 토큰의 내용. 역할은 발급 시점의 스냅샷이며 갱신 전까지 바뀌지 않는다.
 */
public record SessionClaims(
        UUID userId,
        String email,
        String name,
        Set<RoleName> roles,
        OffsetDateTime issuedAt,
        OffsetDateTime expiresAt
) {

    public SessionClaims {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }
}
