package com.taildeck.backend.modules.identity.domain;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import com.taildeck.backend.modules.rbac.domain.RoleName;

/**
 * ID 제공자 그룹명 → 역할 고정 매핑. 알 수 없는 그룹은 무시된다.
 */
public final class GroupRoleMapping {

    private static final Map<String, RoleName> GROUP_TO_ROLE = Map.of(
            "TailDeck Admins", RoleName.ADMIN,
            "taildeck-admins", RoleName.ADMIN,
            "TailDeck Operators", RoleName.OPERATOR,
            "taildeck-operators", RoleName.OPERATOR,
            "TailDeck Auditors", RoleName.AUDITOR,
            "taildeck-auditors", RoleName.AUDITOR,
            "TailDeck Users", RoleName.USER,
            "taildeck-users", RoleName.USER
    );

    private GroupRoleMapping() {
    }

    public static Set<RoleName> rolesFor(Collection<String> groups) {
        EnumSet<RoleName> roles = EnumSet.noneOf(RoleName.class);
        if (groups == null) {
            return roles;
        }
        for (String group : groups) {
            if (group == null) {
                continue;
            }
            RoleName role = GROUP_TO_ROLE.get(group);
            if (role != null) {
                roles.add(role);
            }
        }
        return roles;
    }
}
