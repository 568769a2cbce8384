package com.taildeck.backend.modules.upstream.presentation;

import com.taildeck.backend.global.security.authorization.AuthenticatedContext;
import com.taildeck.backend.global.security.authorization.RequiresRoles;
import com.taildeck.backend.modules.rbac.domain.RoleName;
import com.taildeck.backend.modules.upstream.application.ApiKeyService;
import com.taildeck.backend.modules.upstream.client.dto.ApiKeyCreatedResponse;
import com.taildeck.backend.modules.upstream.client.dto.ApiKeyListResponse;
import com.taildeck.backend.modules.upstream.presentation.dto.CreateApiKeyRequest;
import com.taildeck.backend.modules.upstream.presentation.dto.OperationResultResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/headscale/apikeys")
@Tag(name = "API keys", description = "Headscale API 키 관리")
@RequiresRoles(RoleName.OWNER)
public class ApiKeyController {

    private final ApiKeyService apiKeyService;

    public ApiKeyController(ApiKeyService apiKeyService) {
        this.apiKeyService = apiKeyService;
    }

    @GetMapping
    @Operation(summary = "API 키 목록 조회")
    public ResponseEntity<ApiKeyListResponse> list() {
        return ResponseEntity.ok(new ApiKeyListResponse(apiKeyService.listApiKeys()));
    }

    @PostMapping
    @Operation(summary = "API 키 생성", description = "키 원문은 이 응답에서만 확인할 수 있다")
    public ResponseEntity<ApiKeyCreatedResponse> create(
            AuthenticatedContext context,
            @RequestBody(required = false) CreateApiKeyRequest request
    ) {
        String expiration = request != null ? request.expiration() : null;
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new ApiKeyCreatedResponse(apiKeyService.createApiKey(context, expiration)));
    }

    @PostMapping("/{prefix}/expire")
    @Operation(summary = "API 키 만료")
    public ResponseEntity<OperationResultResponse> expire(AuthenticatedContext context,
                                                          @PathVariable("prefix") String prefix) {
        apiKeyService.expireApiKey(context, prefix);
        return ResponseEntity.ok(OperationResultResponse.ok());
    }

    @DeleteMapping("/{prefix}")
    @Operation(summary = "API 키 삭제")
    public ResponseEntity<OperationResultResponse> delete(AuthenticatedContext context,
                                                          @PathVariable("prefix") String prefix) {
        apiKeyService.deleteApiKey(context, prefix);
        return ResponseEntity.ok(OperationResultResponse.ok());
    }
}
