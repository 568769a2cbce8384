package com.taildeck.backend.global.security;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import com.taildeck.backend.modules.auth.application.JwtTokenService;
import com.taildeck.backend.modules.rbac.domain.RoleName;
import com.taildeck.backend.modules.upstream.client.UpstreamClient;
import com.taildeck.backend.support.AbstractIntegrationTest;
import com.taildeck.backend.support.TestSessions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

class AuthorizationIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtTokenService jwtTokenService;

    @MockBean
    private UpstreamClient upstreamClient;

    @Test
    @DisplayName("세션 토큰 없이 최소 역할 엔드포인트를 호출하면 401")
    void missingTokenIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/headscale/nodes/1/expire").header("X-Request-Id", "req-a"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Unauthorized"))
                .andExpect(jsonPath("$.requestId").value("req-a"))
                .andExpect(header().string("X-Request-Id", "req-a"));

        verifyNoInteractions(upstreamClient);
    }

    @Test
    void invalidTokenIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/headscale/nodes/1/expire").header("Authorization", "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Unauthorized"));
    }

    @Test
    @DisplayName("USER 세션이 OPERATOR 최소 역할 엔드포인트를 호출하면 requiredLevel 과 함께 403")
    void userBelowOperatorIsForbidden() throws Exception {
        mockMvc.perform(post("/api/headscale/nodes/1/expire")
                        .header("Authorization", TestSessions.bearer(jwtTokenService, UUID.randomUUID(), RoleName.USER)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("Forbidden"))
                .andExpect(jsonPath("$.requiredLevel").value("OPERATOR"))
                .andExpect(jsonPath("$.required").doesNotExist());

        verifyNoInteractions(upstreamClient);
    }

    @Test
    @DisplayName("정확한 역할 집합 엔드포인트는 상위 역할이라도 목록에 없으면 거부한다")
    void exactSetEndpointListsRequiredRoles() throws Exception {
        mockMvc.perform(get("/api/headscale/policy")
                        .header("Authorization", TestSessions.bearer(jwtTokenService, UUID.randomUUID(), RoleName.OPERATOR)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.required[0]").value("ADMIN"))
                .andExpect(jsonPath("$.required[1]").value("OWNER"));

        mockMvc.perform(get("/api/headscale/apikeys")
                        .header("Authorization", TestSessions.bearer(jwtTokenService, UUID.randomUUID(), RoleName.ADMIN)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.required[0]").value("OWNER"));
    }

    @Test
    @DisplayName("메서드 애노테이션이 클래스 애노테이션보다 우선한다")
    void methodAnnotationOverridesClassAnnotation() throws Exception {
        org.mockito.Mockito.when(upstreamClient.listRoutes())
                .thenReturn(com.taildeck.backend.modules.upstream.client.GatewayResult.success(java.util.List.of()));

        mockMvc.perform(get("/api/headscale/routes")
                        .header("Authorization", TestSessions.bearer(jwtTokenService, UUID.randomUUID(), RoleName.USER)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.routes").isArray());

        mockMvc.perform(post("/api/headscale/routes/r1/enable")
                        .header("Authorization", TestSessions.bearer(jwtTokenService, UUID.randomUUID(), RoleName.USER)))
                .andExpect(status().isForbidden());
    }

    @Test
    void profileReflectsSessionClaims() throws Exception {
        UUID userId = UUID.randomUUID();
        mockMvc.perform(get("/api/me")
                        .header("Authorization", TestSessions.bearer(jwtTokenService, userId, RoleName.AUDITOR)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value(userId.toString()))
                .andExpect(jsonPath("$.effectiveRole").value("AUDITOR"));
    }

    @Test
    void actuatorHealthIsPublic() throws Exception {
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
    }
}
