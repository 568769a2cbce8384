package com.taildeck.backend.modules.upstream.client.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 업스트림 요청 본문.
 */
public final class UpstreamRequests {

    private UpstreamRequests() {
    }

    public record CreateUser(String name) {
    }

    public record SetTags(List<String> tags) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CreatePreAuthKey(String user, Boolean reusable, Boolean ephemeral, String expiration, List<String> aclTags) {
    }

    public record ExpirePreAuthKey(String user, String key) {
    }

    public record SetPolicy(String policy) {
    }

    /**
     * 부분 갱신. null 필드는 보내지 않는다.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SetDns(
            List<String> nameservers,
            List<String> domains,
            @JsonProperty("magicDNS") Boolean magicDns,
            String baseDomain
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CreateApiKey(String expiration) {
    }

    public record ExpireApiKey(String prefix) {
    }
}
