package com.taildeck.backend.modules.upstream.client.dto;

import java.util.List;

public record PreAuthKeyListResponse(List<PreAuthKey> preAuthKeys) {

    public PreAuthKeyListResponse {
        preAuthKeys = preAuthKeys == null ? List.of() : preAuthKeys;
    }
}
