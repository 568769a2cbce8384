package com.taildeck.backend.modules.auth.presentation;

import com.taildeck.backend.global.security.authorization.AuthenticatedContext;
import com.taildeck.backend.modules.auth.application.AuthService;
import com.taildeck.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProfileController {

    private final AuthService authService;

    public ProfileController(AuthService authService) {
        this.authService = authService;
    }

    /**
     * 토큰에 담긴 역할 스냅샷 기준의 현재 사용자 정보.
     */
    @GetMapping("/api/me")
    public ResponseEntity<UserProfileResponse> me(AuthenticatedContext context) {
        return ResponseEntity.ok(authService.buildProfile(
                context.userId(), context.email(), context.name(), context.roles()));
    }
}
