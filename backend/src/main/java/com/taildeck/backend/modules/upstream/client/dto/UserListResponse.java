package com.taildeck.backend.modules.upstream.client.dto;

import java.util.List;

public record UserListResponse(List<UpstreamUser> users) {

    public UserListResponse {
        users = users == null ? List.of() : users;
    }
}
