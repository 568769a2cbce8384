package com.taildeck.backend.modules.rbac.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RoleHierarchyTest {

    private final RoleHierarchy hierarchy = RoleHierarchy.standard();

    @Test
    @DisplayName("최소 역할 판정은 레벨 이상인 역할을 하나라도 가지면 통과한다")
    void meetsMinimumRole() {
        assertThat(hierarchy.meetsMinimumRole(Set.of(RoleName.OWNER), RoleName.OPERATOR)).isTrue();
        assertThat(hierarchy.meetsMinimumRole(Set.of(RoleName.OPERATOR), RoleName.OPERATOR)).isTrue();
        assertThat(hierarchy.meetsMinimumRole(Set.of(RoleName.USER, RoleName.AUDITOR), RoleName.OPERATOR)).isFalse();
        assertThat(hierarchy.meetsMinimumRole(Set.of(RoleName.USER, RoleName.ADMIN), RoleName.OPERATOR)).isTrue();
    }

    @Test
    @DisplayName("빈 역할 집합은 모든 질의에서 거부된다")
    void emptyRoleSetFailsEveryQuery() {
        Set<RoleName> none = Set.of();
        assertThat(hierarchy.meetsMinimumRole(none, RoleName.USER)).isFalse();
        assertThat(hierarchy.hasAnyRole(none, List.of(RoleName.values()))).isFalse();
        assertThat(hierarchy.hasRole(none, RoleName.USER)).isFalse();
        assertThat(hierarchy.highestRole(none)).isEmpty();
        assertThat(hierarchy.canAssignRole(none, RoleName.USER)).isFalse();
    }

    @Test
    @DisplayName("정확한 역할 집합 모드는 상위 역할을 암묵적으로 포함하지 않는다")
    void hasAnyRoleIsExactSet() {
        assertThat(hierarchy.hasAnyRole(Set.of(RoleName.OWNER), List.of(RoleName.AUDITOR))).isFalse();
        assertThat(hierarchy.hasAnyRole(Set.of(RoleName.AUDITOR), List.of(RoleName.AUDITOR, RoleName.ADMIN))).isTrue();
    }

    @Test
    void rolesAtOrAboveOperator() {
        assertThat(hierarchy.rolesAtOrAbove(RoleName.OPERATOR))
                .containsExactlyInAnyOrder(RoleName.OPERATOR, RoleName.ADMIN, RoleName.OWNER);
        assertThat(hierarchy.rolesAtOrAbove(RoleName.USER)).containsExactlyInAnyOrder(RoleName.values());
    }

    @Test
    @DisplayName("유효 역할은 보유 역할 중 레벨이 가장 높은 역할이다")
    void highestRoleIsEffectiveRole() {
        assertThat(hierarchy.highestRole(EnumSet.of(RoleName.USER, RoleName.AUDITOR, RoleName.OPERATOR)))
                .contains(RoleName.OPERATOR);
        assertThat(hierarchy.highest()).isEqualTo(RoleName.OWNER);
        assertThat(hierarchy.lowest()).isEqualTo(RoleName.USER);
    }

    @Test
    @DisplayName("OWNER는 모든 역할을, ADMIN은 OWNER를 제외한 역할을 부여할 수 있다")
    void assignableRoles() {
        assertThat(hierarchy.assignableRoles(RoleName.OWNER)).containsExactlyInAnyOrder(RoleName.values());
        assertThat(hierarchy.assignableRoles(RoleName.ADMIN))
                .containsExactlyInAnyOrder(RoleName.ADMIN, RoleName.OPERATOR, RoleName.AUDITOR, RoleName.USER);
        assertThat(hierarchy.assignableRoles(RoleName.OPERATOR)).isEmpty();
        assertThat(hierarchy.canAssignRole(Set.of(RoleName.USER, RoleName.ADMIN), RoleName.OWNER)).isFalse();
        assertThat(hierarchy.canAssignRole(Set.of(RoleName.OWNER), RoleName.OWNER)).isTrue();
    }

    @Test
    @DisplayName("부여 권한은 역할 이름이 아니라 레벨 순서를 따른다")
    void assignableRolesFollowLevelsNotNames() {
        Map<RoleName, Integer> levels = new EnumMap<>(RoleName.class);
        levels.put(RoleName.USER, 10);
        levels.put(RoleName.AUDITOR, 20);
        levels.put(RoleName.ADMIN, 30);
        levels.put(RoleName.OPERATOR, 40);
        levels.put(RoleName.OWNER, 50);
        RoleHierarchy reordered = new RoleHierarchy(levels);

        assertThat(reordered.secondHighest()).isEqualTo(RoleName.OPERATOR);
        assertThat(reordered.assignableRoles(RoleName.OPERATOR))
                .containsExactlyInAnyOrder(RoleName.OPERATOR, RoleName.ADMIN, RoleName.AUDITOR, RoleName.USER);
        assertThat(reordered.assignableRoles(RoleName.ADMIN)).isEmpty();
        assertThat(hierarchy.secondHighest()).isEqualTo(RoleName.ADMIN);
    }

    @Test
    @DisplayName("레벨이 중복되면 계층을 만들 수 없다")
    void duplicateLevelsAreRejected() {
        Map<RoleName, Integer> levels = new EnumMap<>(RoleName.class);
        for (RoleName role : RoleName.values()) {
            levels.put(role, role.level());
        }
        levels.put(RoleName.AUDITOR, RoleName.OPERATOR.level());

        assertThatThrownBy(() -> new RoleHierarchy(levels))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate hierarchy level");
    }

    @Test
    void missingLevelIsRejected() {
        Map<RoleName, Integer> levels = new EnumMap<>(RoleName.class);
        levels.put(RoleName.OWNER, 100);

        assertThatThrownBy(() -> new RoleHierarchy(levels))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Missing hierarchy level");
    }
}
