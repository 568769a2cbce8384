package com.taildeck.backend.modules.upstream.client.dto;

public record ApiKey(String id, String prefix, String expiration, String createdAt, String lastSeen) {
}
