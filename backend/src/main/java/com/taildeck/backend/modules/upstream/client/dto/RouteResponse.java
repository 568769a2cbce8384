package com.taildeck.backend.modules.upstream.client.dto;

public record RouteResponse(UpstreamRoute route) {
}
