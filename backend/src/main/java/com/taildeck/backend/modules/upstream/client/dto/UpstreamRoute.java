package com.taildeck.backend.modules.upstream.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UpstreamRoute(
        String id,
        UpstreamNode node,
        String prefix,
        Boolean advertised,
        Boolean enabled,
        @JsonProperty("isPrimary") Boolean primary,
        String createdAt,
        String updatedAt,
        String deletedAt
) {
}
