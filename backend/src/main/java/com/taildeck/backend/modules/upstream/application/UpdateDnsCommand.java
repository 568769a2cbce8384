package com.taildeck.backend.modules.upstream.application;

import java.util.List;

public record UpdateDnsCommand(List<String> nameservers, List<String> domains, Boolean magicDns, String baseDomain) {
}
