package com.taildeck.backend.modules.upstream.client.dto;

import java.util.List;

public record ApiKeyListResponse(List<ApiKey> apiKeys) {

    public ApiKeyListResponse {
        apiKeys = apiKeys == null ? List.of() : apiKeys;
    }
}
