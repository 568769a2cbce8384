package com.taildeck.backend.modules.audit.domain;

import java.util.Arrays;
import java.util.List;

public enum AuditAction {
    // 노드
    CREATE_NODE,
    DELETE_NODE,
    RENAME_NODE,
    UPDATE_TAGS,
    EXPIRE_NODE,
    MOVE_NODE,
    BULK_DELETE,
    BULK_EXPIRE,
    BULK_MOVE,
    BULK_TAGS,
    // 라우트
    ENABLE_ROUTE,
    DISABLE_ROUTE,
    DELETE_ROUTE,
    // 정책
    UPDATE_ACL,
    // 키
    CREATE_KEY,
    EXPIRE_KEY,
    DELETE_KEY,
    CREATE_API_KEY,
    DELETE_API_KEY,
    EXPIRE_API_KEY,
    UPDATE_DNS,
    // 사용자/역할
    CREATE_USER,
    DELETE_USER,
    RENAME_USER,
    ASSIGN_ROLE,
    REMOVE_ROLE,
    UPDATE_SETTING,
    USER_LOGIN,
    USER_LOGOUT;

    public static List<String> names() {
        return Arrays.stream(values()).map(Enum::name).toList();
    }
}
