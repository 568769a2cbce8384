package com.taildeck.backend.modules.upstream.client.dto;

public record PreAuthKeyResponse(PreAuthKey preAuthKey) {
}
