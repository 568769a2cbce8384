package com.taildeck.backend.modules.upstream.presentation;

import com.taildeck.backend.global.security.authorization.AuthenticatedContext;
import com.taildeck.backend.global.security.authorization.RequiresRoles;
import com.taildeck.backend.modules.rbac.domain.RoleName;
import com.taildeck.backend.modules.upstream.application.PreAuthKeyService;
import com.taildeck.backend.modules.upstream.client.dto.PreAuthKeyListResponse;
import com.taildeck.backend.modules.upstream.client.dto.PreAuthKeyResponse;
import com.taildeck.backend.modules.upstream.presentation.dto.CreatePreAuthKeyRequest;
import com.taildeck.backend.modules.upstream.presentation.dto.ExpirePreAuthKeyRequest;
import com.taildeck.backend.modules.upstream.presentation.dto.OperationResultResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/headscale/preauthkeys")
@Tag(name = "Pre-auth keys", description = "기기 등록용 사전 인증 키")
@RequiresRoles({RoleName.OPERATOR, RoleName.ADMIN, RoleName.OWNER})
public class PreAuthKeyController {

    private final PreAuthKeyService preAuthKeyService;

    public PreAuthKeyController(PreAuthKeyService preAuthKeyService) {
        this.preAuthKeyService = preAuthKeyService;
    }

    @GetMapping
    @Operation(summary = "사전 인증 키 목록 조회")
    public ResponseEntity<PreAuthKeyListResponse> list(@RequestParam("user") String user) {
        return ResponseEntity.ok(new PreAuthKeyListResponse(preAuthKeyService.listKeys(user)));
    }

    @PostMapping
    @Operation(summary = "사전 인증 키 생성")
    public ResponseEntity<PreAuthKeyResponse> create(
            AuthenticatedContext context,
            @Valid @RequestBody CreatePreAuthKeyRequest request
    ) {
        return ResponseEntity.ok(new PreAuthKeyResponse(preAuthKeyService.createKey(context, request.toCommand())));
    }

    @PostMapping("/expire")
    @Operation(summary = "사전 인증 키 만료")
    public ResponseEntity<OperationResultResponse> expire(
            AuthenticatedContext context,
            @Valid @RequestBody ExpirePreAuthKeyRequest request
    ) {
        preAuthKeyService.expireKey(context, request.user(), request.key());
        return ResponseEntity.ok(OperationResultResponse.ok());
    }
}
