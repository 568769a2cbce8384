package com.taildeck.backend.modules.audit.domain;

import java.util.Arrays;
import java.util.List;

public enum AuditResourceType {
    NODE,
    ROUTE,
    ACL,
    KEY,
    API_KEY,
    DNS,
    USER,
    ROLE,
    SETTING;

    public static List<String> names() {
        return Arrays.stream(values()).map(Enum::name).toList();
    }
}
