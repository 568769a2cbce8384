package com.taildeck.backend.modules.upstream.presentation;

import com.taildeck.backend.global.security.authorization.AuthenticatedContext;
import com.taildeck.backend.global.security.authorization.RequiresRoles;
import com.taildeck.backend.modules.rbac.domain.RoleName;
import com.taildeck.backend.modules.upstream.application.DnsService;
import com.taildeck.backend.modules.upstream.client.dto.DnsResponse;
import com.taildeck.backend.modules.upstream.presentation.dto.SetDnsRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/headscale/dns")
@Tag(name = "DNS", description = "DNS 설정")
@RequiresRoles({RoleName.ADMIN, RoleName.OWNER})
public class DnsController {

    private final DnsService dnsService;

    public DnsController(DnsService dnsService) {
        this.dnsService = dnsService;
    }

    @GetMapping
    @Operation(summary = "DNS 설정 조회")
    public ResponseEntity<DnsResponse> get() {
        return ResponseEntity.ok(dnsService.getDns());
    }

    @PutMapping
    @Operation(summary = "DNS 설정 변경", description = "전달된 필드만 변경한다")
    public ResponseEntity<DnsResponse> update(
            AuthenticatedContext context,
            @Valid @RequestBody SetDnsRequest request
    ) {
        return ResponseEntity.ok(dnsService.updateDns(context, request.toCommand()));
    }
}
