package com.taildeck.backend.modules.auth.presentation;

import com.taildeck.backend.global.web.ClientIpResolver;
import com.taildeck.backend.modules.auth.application.AuthService;
import com.taildeck.backend.modules.auth.presentation.dto.LoginRequest;
import com.taildeck.backend.modules.auth.presentation.dto.LoginResponse;
import com.taildeck.backend.modules.auth.presentation.dto.LogoutRequest;
import com.taildeck.backend.modules.auth.presentation.dto.RefreshRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Auth", description = "세션 발급/갱신/종료")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/auth/login")
    @Operation(summary = "ID 제공자 토큰으로 로그인")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request, HttpServletRequest servletRequest) {
        return ResponseEntity.ok(authService.login(request, ClientIpResolver.resolve(servletRequest)));
    }

    @PostMapping("/auth/refresh")
    @Operation(summary = "세션 갱신", description = "갱신 토큰을 회전하고 역할을 다시 읽는다")
    public ResponseEntity<LoginResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(authService.refresh(request));
    }

    @PostMapping("/auth/logout")
    @Operation(summary = "로그아웃")
    public ResponseEntity<Void> logout(@Valid @RequestBody LogoutRequest request, HttpServletRequest servletRequest) {
        authService.logout(request, ClientIpResolver.resolve(servletRequest));
        return ResponseEntity.noContent().build();
    }
}
