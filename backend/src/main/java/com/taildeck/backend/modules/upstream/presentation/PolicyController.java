package com.taildeck.backend.modules.upstream.presentation;

import com.taildeck.backend.global.security.authorization.AuthenticatedContext;
import com.taildeck.backend.global.security.authorization.RequiresRoles;
import com.taildeck.backend.modules.rbac.domain.RoleName;
import com.taildeck.backend.modules.upstream.application.PolicyService;
import com.taildeck.backend.modules.upstream.client.dto.PolicyResponse;
import com.taildeck.backend.modules.upstream.presentation.dto.SetPolicyRequest;

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
@RequestMapping("/api/headscale/policy")
@Tag(name = "Policy", description = "ACL 정책")
@RequiresRoles({RoleName.ADMIN, RoleName.OWNER})
public class PolicyController {

    private final PolicyService policyService;

    public PolicyController(PolicyService policyService) {
        this.policyService = policyService;
    }

    @GetMapping
    @Operation(summary = "ACL 정책 조회")
    public ResponseEntity<PolicyResponse> get() {
        return ResponseEntity.ok(policyService.getPolicy());
    }

    @PutMapping
    @Operation(summary = "ACL 정책 변경", description = "JSON 형식이 아니면 업스트림 호출 전에 거부한다")
    public ResponseEntity<PolicyResponse> update(
            AuthenticatedContext context,
            @Valid @RequestBody SetPolicyRequest request
    ) {
        return ResponseEntity.ok(policyService.updatePolicy(context, request.policy()));
    }
}
