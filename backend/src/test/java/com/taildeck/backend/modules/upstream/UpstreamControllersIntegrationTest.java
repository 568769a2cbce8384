package com.taildeck.backend.modules.upstream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.UUID;

import com.taildeck.backend.modules.auth.application.JwtTokenService;
import com.taildeck.backend.modules.rbac.domain.RoleName;
import com.taildeck.backend.modules.upstream.client.GatewayError;
import com.taildeck.backend.modules.upstream.client.GatewayErrorKind;
import com.taildeck.backend.modules.upstream.client.GatewayResult;
import com.taildeck.backend.modules.upstream.client.UpstreamClient;
import com.taildeck.backend.modules.upstream.client.dto.DnsConfiguration;
import com.taildeck.backend.modules.upstream.client.dto.DnsResponse;
import com.taildeck.backend.modules.upstream.client.dto.UpstreamNode;
import com.taildeck.backend.support.AbstractIntegrationTest;
import com.taildeck.backend.support.TestSessions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

class UpstreamControllersIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtTokenService jwtTokenService;

    @MockBean
    private UpstreamClient upstreamClient;

    @Test
    @DisplayName("일괄 만료는 노드별 결과를 돌려주고 성공한 노드만 감사 항목에 남긴다")
    void bulkExpireReportsPerNodeResults() throws Exception {
        given(upstreamClient.expireNode("1")).willReturn(GatewayResult.success(node("1")));
        given(upstreamClient.expireNode("2")).willReturn(GatewayResult.failure(
                new GatewayError(GatewayErrorKind.NOT_FOUND, 404, "node not found", "5")));
        given(upstreamClient.expireNode("3")).willReturn(GatewayResult.success(node("3")));

        mockMvc.perform(post("/api/headscale/nodes/bulk")
                        .header("Authorization", token(RoleName.OPERATOR))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"expire\",\"nodeIds\":[\"1\",\"2\",\"3\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("expire"))
                .andExpect(jsonPath("$.summary.total").value(3))
                .andExpect(jsonPath("$.summary.succeeded").value(2))
                .andExpect(jsonPath("$.summary.failed").value(1))
                .andExpect(jsonPath("$.results[1].success").value(false))
                .andExpect(jsonPath("$.results[1].error").value("node not found"))
                .andExpect(jsonPath("$.results[0].error").doesNotExist());

        assertThat(countAuditRows("BULK_EXPIRE")).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject(
                "select resource_id from audit_log where action = 'BULK_EXPIRE'", String.class)).isEqualTo("1,3");
    }

    @Test
    void bulkRejectsUnknownActionAndEmptySelection() throws Exception {
        mockMvc.perform(post("/api/headscale/nodes/bulk")
                        .header("Authorization", token(RoleName.ADMIN))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"reboot\",\"nodeIds\":[\"1\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.validValues[0]").value("delete"));

        mockMvc.perform(post("/api/headscale/nodes/bulk")
                        .header("Authorization", token(RoleName.ADMIN))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"expire\",\"nodeIds\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(upstreamClient);
    }

    @Test
    @DisplayName("일괄 태그 요청의 null 태그는 400 으로 거절한다")
    void bulkTagsWithNullTagIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/headscale/nodes/bulk")
                        .header("Authorization", token(RoleName.OPERATOR))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"tags\",\"nodeIds\":[\"1\"],\"tags\":[\"tag:a\",null]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(upstreamClient);
        assertThat(countAuditRows("BULK_TAGS")).isZero();
    }

    @Test
    @DisplayName("OPERATOR 는 일괄 삭제를 할 수 없다")
    void bulkDeleteRequiresAdmin() throws Exception {
        mockMvc.perform(post("/api/headscale/nodes/bulk")
                        .header("Authorization", token(RoleName.OPERATOR))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"delete\",\"nodeIds\":[\"1\"]}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.requiredLevel").value("ADMIN"));

        verifyNoInteractions(upstreamClient);
    }

    @Test
    void updateNodeRejectsMalformedTags() throws Exception {
        mockMvc.perform(patch("/api/headscale/nodes/7")
                        .header("Authorization", token(RoleName.OPERATOR))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tags\":[\"server\"]}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(upstreamClient);
    }

    @Test
    @DisplayName("JSON 이 아닌 정책은 업스트림을 호출하지 않고 400")
    void invalidPolicyIsRejectedLocally() throws Exception {
        mockMvc.perform(put("/api/headscale/policy")
                        .header("Authorization", token(RoleName.ADMIN))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"policy\":\"acls: []\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_POLICY"));

        verify(upstreamClient, never()).setPolicy(anyString());
        assertThat(countAuditRows("UPDATE_ACL")).isZero();
    }

    @Test
    @DisplayName("DNS 설정은 ADMIN 과 OWNER 만 다룬다")
    void dnsRequiresAdmin() throws Exception {
        mockMvc.perform(get("/api/headscale/dns")
                        .header("Authorization", token(RoleName.OPERATOR)))
                .andExpect(status().isForbidden());

        verifyNoInteractions(upstreamClient);
    }

    @Test
    void adminUpdatesDnsAndIsAudited() throws Exception {
        given(upstreamClient.setDns(any())).willReturn(GatewayResult.success(new DnsResponse(
                new DnsConfiguration(List.of("1.1.1.1"), List.of(), true, "ts.example"))));

        mockMvc.perform(put("/api/headscale/dns")
                        .header("Authorization", token(RoleName.ADMIN))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"nameservers\":[\"1.1.1.1\"],\"magicDNS\":true,\"baseDomain\":\"ts.example\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dns.nameservers[0]").value("1.1.1.1"))
                .andExpect(jsonPath("$.dns.magicDNS").value(true));

        assertThat(countAuditRows("UPDATE_DNS")).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject(
                "select resource_type from audit_log where action = 'UPDATE_DNS'", String.class))
                .isEqualTo("DNS");
    }

    @Test
    void dnsUpdateTimeoutWritesNoAudit() throws Exception {
        given(upstreamClient.setDns(any())).willReturn(GatewayResult.failure(GatewayError.timeout("Request timed out")));

        mockMvc.perform(put("/api/headscale/dns")
                        .header("Authorization", token(RoleName.OWNER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"magicDNS\":false}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("UPSTREAM_TIMEOUT"));

        assertThat(countAuditRows("UPDATE_DNS")).isZero();
    }

    @Test
    void ownerCreatesApiKey() throws Exception {
        given(upstreamClient.createApiKey(null)).willReturn(GatewayResult.success("tskey-api-abc123"));

        mockMvc.perform(post("/api/headscale/apikeys").header("Authorization", token(RoleName.OWNER)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.apiKey").value("tskey-api-abc123"));

        assertThat(countAuditRows("CREATE_API_KEY")).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject(
                "select metadata from audit_log where action = 'CREATE_API_KEY'", String.class))
                .doesNotContain("tskey-api-abc123");
    }

    @Test
    void upstreamUnavailableBecomesServiceUnavailable() throws Exception {
        given(upstreamClient.listNodes()).willReturn(GatewayResult.failure(
                GatewayError.connectionError("Unable to connect to Headscale")));

        mockMvc.perform(get("/api/headscale/nodes")
                        .header("Authorization", token(RoleName.USER)))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("UPSTREAM_UNAVAILABLE"));
    }

    private String token(RoleName role) {
        return TestSessions.bearer(jwtTokenService, UUID.randomUUID(), role);
    }

    private static UpstreamNode node(String id) {
        return new UpstreamNode(id, null, null, null, "node-" + id, null, null, null,
                null, null, null, false, null, null, null, null, null);
    }
}
