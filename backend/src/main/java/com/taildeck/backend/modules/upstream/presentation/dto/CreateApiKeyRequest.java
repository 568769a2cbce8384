package com.taildeck.backend.modules.upstream.presentation.dto;

public record CreateApiKeyRequest(String expiration) {
}
