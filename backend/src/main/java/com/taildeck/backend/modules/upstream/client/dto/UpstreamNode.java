package com.taildeck.backend.modules.upstream.client.dto;

import java.util.List;

public record UpstreamNode(
        String id,
        String machineKey,
        String nodeKey,
        List<String> ipAddresses,
        String name,
        UpstreamUser user,
        String lastSeen,
        String expiry,
        List<String> forcedTags,
        List<String> validTags,
        String givenName,
        Boolean online,
        String registerMethod,
        String createdAt,
        List<String> availableRoutes,
        List<String> approvedRoutes,
        List<String> subnetRoutes
) {

    public String displayName() {
        return givenName != null && !givenName.isBlank() ? givenName : name;
    }

    public String userName() {
        return user != null ? user.name() : null;
    }
}
