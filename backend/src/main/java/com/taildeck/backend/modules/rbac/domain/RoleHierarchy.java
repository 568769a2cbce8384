package com.taildeck.backend.modules.rbac.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 역할 레벨 기반의 판정 규칙 모음. 상태가 없는 순수 함수이며 생성 시점에 레벨 중복을 검증한다.
 * 빈 역할 집합은 모든 질의에서 거부된다.
 */
public final class RoleHierarchy {

    private final Map<RoleName, Integer> levels;

    public RoleHierarchy(Map<RoleName, Integer> levels) {
        Objects.requireNonNull(levels, "levels");
        EnumMap<RoleName, Integer> copy = new EnumMap<>(RoleName.class);
        copy.putAll(levels);
        for (RoleName role : RoleName.values()) {
            if (!copy.containsKey(role)) {
                throw new IllegalArgumentException("Missing hierarchy level for role " + role);
            }
        }
        Set<Integer> seen = new HashSet<>();
        for (Map.Entry<RoleName, Integer> entry : copy.entrySet()) {
            if (!seen.add(entry.getValue())) {
                throw new IllegalArgumentException("Duplicate hierarchy level " + entry.getValue()
                        + " for role " + entry.getKey());
            }
        }
        this.levels = Collections.unmodifiableMap(copy);
    }

    public static RoleHierarchy standard() {
        EnumMap<RoleName, Integer> levels = new EnumMap<>(RoleName.class);
        for (RoleName role : RoleName.values()) {
            levels.put(role, role.level());
        }
        return new RoleHierarchy(levels);
    }

    public int levelOf(RoleName role) {
        return levels.get(role);
    }

    public boolean hasRole(Set<RoleName> held, RoleName required) {
        return held != null && required != null && held.contains(required);
    }

    public boolean hasAnyRole(Set<RoleName> held, Collection<RoleName> allowed) {
        if (held == null || held.isEmpty() || allowed == null) {
            return false;
        }
        return allowed.stream().anyMatch(held::contains);
    }

    public boolean meetsMinimumRole(Set<RoleName> held, RoleName minimum) {
        if (held == null || held.isEmpty() || minimum == null) {
            return false;
        }
        int required = levelOf(minimum);
        return held.stream().anyMatch(role -> levelOf(role) >= required);
    }

    public Set<RoleName> rolesAtOrAbove(RoleName minimum) {
        int required = levelOf(minimum);
        EnumSet<RoleName> result = EnumSet.noneOf(RoleName.class);
        levels.forEach((role, level) -> {
            if (level >= required) {
                result.add(role);
            }
        });
        return Collections.unmodifiableSet(result);
    }

    public Optional<RoleName> highestRole(Set<RoleName> held) {
        if (held == null || held.isEmpty()) {
            return Optional.empty();
        }
        return held.stream().max(Comparator.comparingInt(this::levelOf));
    }

    public RoleName highest() {
        return levels.keySet().stream().max(Comparator.comparingInt(this::levelOf)).orElseThrow();
    }

    /**
     * 최상위 바로 아래 레벨의 역할.
     */
    public RoleName secondHighest() {
        RoleName top = highest();
        return levels.keySet().stream()
                .filter(role -> role != top)
                .max(Comparator.comparingInt(this::levelOf))
                .orElseThrow();
    }

    public RoleName lowest() {
        return levels.keySet().stream().min(Comparator.comparingInt(this::levelOf)).orElseThrow();
    }

    /**
     * 최상위 역할은 모든 역할을, 그 바로 아래 역할은 최상위를 제외한 역할을 부여할 수 있다.
     */
    public Set<RoleName> assignableRoles(RoleName assigner) {
        if (assigner == null) {
            return Set.of();
        }
        RoleName top = highest();
        if (assigner == top) {
            return Collections.unmodifiableSet(EnumSet.allOf(RoleName.class));
        }
        if (assigner == secondHighest()) {
            EnumSet<RoleName> result = EnumSet.allOf(RoleName.class);
            result.remove(top);
            return Collections.unmodifiableSet(result);
        }
        return Set.of();
    }

    public boolean canAssignRole(RoleName assigner, RoleName target) {
        return target != null && assignableRoles(assigner).contains(target);
    }

    public boolean canAssignRole(Set<RoleName> assignerRoles, RoleName target) {
        return highestRole(assignerRoles)
                .map(highest -> canAssignRole(highest, target))
                .orElse(false);
    }
}
