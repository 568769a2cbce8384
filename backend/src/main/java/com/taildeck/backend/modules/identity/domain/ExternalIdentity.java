package com.taildeck.backend.modules.identity.domain;

import java.util.List;

/**
 * 검증이 끝난 ID 제공자 토큰에서 추출한 신원 정보.
 */
public record ExternalIdentity(String subject, String email, String name, List<String> groups) {

    public ExternalIdentity {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be blank");
        }
        groups = groups == null ? List.of() : List.copyOf(groups);
    }
}
