package com.taildeck.backend.modules.upstream.client.dto;

public record NodeResponse(UpstreamNode node) {
}
