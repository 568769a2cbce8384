package com.taildeck.backend.modules.upstream.client.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DnsConfiguration(
        List<String> nameservers,
        List<String> domains,
        @JsonProperty("magicDNS") Boolean magicDns,
        String baseDomain
) {

    public static DnsConfiguration empty() {
        return new DnsConfiguration(List.of(), List.of(), false, null);
    }

    public DnsConfiguration {
        nameservers = nameservers == null ? List.of() : nameservers;
        domains = domains == null ? List.of() : domains;
        magicDns = magicDns != null && magicDns;
    }
}
