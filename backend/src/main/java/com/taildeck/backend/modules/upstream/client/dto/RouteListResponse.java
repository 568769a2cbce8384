package com.taildeck.backend.modules.upstream.client.dto;

import java.util.List;

public record RouteListResponse(List<UpstreamRoute> routes) {

    public RouteListResponse {
        routes = routes == null ? List.of() : routes;
    }
}
