package com.taildeck.backend.modules.upstream.presentation.dto;

import java.util.List;

import com.taildeck.backend.modules.upstream.application.UpdateDnsCommand;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;

public record SetDnsRequest(
        List<@NotBlank String> nameservers,
        List<@NotBlank String> domains,
        @JsonProperty("magicDNS") Boolean magicDns,
        String baseDomain
) {

    public UpdateDnsCommand toCommand() {
        return new UpdateDnsCommand(nameservers, domains, magicDns, baseDomain);
    }
}
