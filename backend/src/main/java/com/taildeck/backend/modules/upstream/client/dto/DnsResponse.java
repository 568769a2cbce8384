package com.taildeck.backend.modules.upstream.client.dto;

public record DnsResponse(DnsConfiguration dns) {

    public DnsResponse {
        // DNS 설정이 없는 Headscale 은 dns 필드를 생략한다
        dns = dns == null ? DnsConfiguration.empty() : dns;
    }
}
