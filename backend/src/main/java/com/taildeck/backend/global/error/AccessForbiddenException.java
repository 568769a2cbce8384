package com.taildeck.backend.global.error;

import java.util.List;

import org.springframework.http.HttpStatus;

/**
 * 역할 요구사항 불충족. 정확한 역할 집합 모드면 {@code required},
 * 최소 역할 모드면 {@code requiredLevel}이 채워진다.
 */
public class AccessForbiddenException extends ProblemException {

    public static final String CODE = "FORBIDDEN";

    private final List<String> required;
    private final String requiredLevel;

    private AccessForbiddenException(List<String> required, String requiredLevel, String message) {
        super(HttpStatus.FORBIDDEN, CODE, "Forbidden", message);
        this.required = required;
        this.requiredLevel = requiredLevel;
    }

    public static AccessForbiddenException requiringAnyOf(List<String> required) {
        return new AccessForbiddenException(List.copyOf(required), null, null);
    }

    public static AccessForbiddenException requiringLevel(String requiredLevel) {
        return new AccessForbiddenException(null, requiredLevel, null);
    }

    public static AccessForbiddenException withMessage(String message) {
        return new AccessForbiddenException(null, null, message);
    }

    public List<String> getRequired() {
        return required;
    }

    public String getRequiredLevel() {
        return requiredLevel;
    }
}
