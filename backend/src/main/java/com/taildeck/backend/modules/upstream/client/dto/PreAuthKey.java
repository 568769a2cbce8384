package com.taildeck.backend.modules.upstream.client.dto;

import java.util.List;

public record PreAuthKey(
        String id,
        String key,
        String user,
        Boolean reusable,
        Boolean ephemeral,
        Boolean used,
        String expiration,
        String createdAt,
        List<String> aclTags
) {
}
