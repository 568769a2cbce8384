package com.taildeck.backend.modules.upstream.client.dto;

public record UserResponse(UpstreamUser user) {
}
