package com.taildeck.backend.modules.upstream.client.dto;

import java.util.List;

public record NodeListResponse(List<UpstreamNode> nodes) {

    public NodeListResponse {
        nodes = nodes == null ? List.of() : nodes;
    }
}
