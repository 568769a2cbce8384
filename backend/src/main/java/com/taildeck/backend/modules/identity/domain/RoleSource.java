package com.taildeck.backend.modules.identity.domain;

/**
 * 역할 부여 출처. OIDC 행은 ID 동기화가, DATABASE 행은 관리자와 최초 소유자 부트스트랩이 관리한다.
 */
public enum RoleSource {
    OIDC,
    DATABASE
}
