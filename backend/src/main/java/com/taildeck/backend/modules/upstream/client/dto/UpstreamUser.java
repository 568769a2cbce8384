package com.taildeck.backend.modules.upstream.client.dto;

public record UpstreamUser(String id, String name, String createdAt, String displayName, String email) {
}
