package com.taildeck.backend.modules.upstream.client.dto;

public record PolicyResponse(String policy, String updatedAt) {
}
