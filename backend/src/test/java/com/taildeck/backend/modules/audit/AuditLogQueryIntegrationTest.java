package com.taildeck.backend.modules.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taildeck.backend.modules.audit.application.AuditActor;
import com.taildeck.backend.modules.audit.application.AuditEntry;
import com.taildeck.backend.modules.audit.application.AuditLogService;
import com.taildeck.backend.modules.audit.application.AuditWriteResult;
import com.taildeck.backend.modules.audit.domain.AuditAction;
import com.taildeck.backend.modules.audit.domain.AuditResourceType;
import com.taildeck.backend.modules.auth.application.JwtTokenService;
import com.taildeck.backend.modules.rbac.domain.RoleName;
import com.taildeck.backend.support.AbstractIntegrationTest;
import com.taildeck.backend.support.TestSessions;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

class AuditLogQueryIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JwtTokenService jwtTokenService;

    @Autowired
    private AuditLogService auditLogService;

    private final AuditActor actor = new AuditActor(UUID.randomUUID(), "operator@taildeck.test", "10.0.0.7");

    private String auditorToken;

    @BeforeEach
    void setUp() {
        auditorToken = TestSessions.bearer(jwtTokenService, UUID.randomUUID(), RoleName.AUDITOR);
    }

    @Test
    @DisplayName("action 필터와 페이지 크기를 적용하면 최신순 10건과 전체 개수를 돌려준다")
    void filtersByActionAndPaginatesNewestFirst() throws Exception {
        for (int i = 1; i <= 12; i++) {
            write(AuditEntry.of(AuditAction.DELETE_NODE, actor, AuditResourceType.NODE, String.valueOf(i))
                    .withMetadata("nodeName", "node-" + i));
        }
        write(AuditEntry.of(AuditAction.ENABLE_ROUTE, actor, AuditResourceType.ROUTE, "r1"));
        write(AuditEntry.of(AuditAction.UPDATE_ACL, actor, AuditResourceType.ACL, "policy"));
        write(AuditEntry.of(AuditAction.CREATE_KEY, actor, AuditResourceType.KEY, "7"));

        MvcResult result = mockMvc.perform(get("/api/audit")
                        .param("action", "DELETE_NODE")
                        .param("limit", "10")
                        .param("offset", "0")
                        .header("Authorization", auditorToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries.length()").value(10))
                .andExpect(jsonPath("$.total").value(12))
                .andExpect(jsonPath("$.limit").value(10))
                .andExpect(jsonPath("$.offset").value(0))
                .andExpect(jsonPath("$.hasMore").value(true))
                .andExpect(jsonPath("$.entries[0].action").value("DELETE_NODE"))
                .andExpect(jsonPath("$.entries[0].actorEmail").value("operator@taildeck.test"))
                .andExpect(jsonPath("$.entries[0].metadata.nodeName").value("node-12"))
                .andReturn();

        JsonNode entries = objectMapper.readTree(result.getResponse().getContentAsString()).get("entries");
        List<Long> ids = new ArrayList<>();
        entries.forEach(node -> ids.add(node.get("id").asLong()));
        assertThat(ids).isSortedAccordingTo((a, b) -> Long.compare(b, a));

        mockMvc.perform(get("/api/audit")
                        .param("action", "DELETE_NODE")
                        .param("limit", "10")
                        .param("offset", "10")
                        .header("Authorization", auditorToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries.length()").value(2))
                .andExpect(jsonPath("$.hasMore").value(false));
    }

    @Test
    void rejectsUnknownActionWithValidValues() throws Exception {
        mockMvc.perform(get("/api/audit")
                        .param("action", "REBOOT_EVERYTHING")
                        .header("Authorization", auditorToken))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PARAMETER"))
                .andExpect(jsonPath("$.validValues").isArray())
                .andExpect(jsonPath("$.validValues[0]").value(AuditAction.values()[0].name()));
    }

    @Test
    @DisplayName("limit 은 최대값으로 잘린다")
    void clampsLimit() throws Exception {
        write(AuditEntry.of(AuditAction.ENABLE_ROUTE, actor, AuditResourceType.ROUTE, "r1"));

        mockMvc.perform(get("/api/audit")
                        .param("limit", "5000")
                        .header("Authorization", auditorToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.limit").value(100))
                .andExpect(jsonPath("$.total").value(1));
    }

    @Test
    void filtersByDateRangeAndResource() throws Exception {
        write(AuditEntry.of(AuditAction.ENABLE_ROUTE, actor, AuditResourceType.ROUTE, "r1"));
        write(AuditEntry.of(AuditAction.DISABLE_ROUTE, actor, AuditResourceType.ROUTE, "r1"));
        write(AuditEntry.of(AuditAction.ENABLE_ROUTE, actor, AuditResourceType.ROUTE, "r2"));

        mockMvc.perform(get("/api/audit")
                        .param("startDate", "2999-01-01T00:00:00Z")
                        .header("Authorization", auditorToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(0));

        mockMvc.perform(get("/api/audit")
                        .param("endDate", "2000-01-01T00:00:00Z")
                        .header("Authorization", auditorToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(0));

        mockMvc.perform(get("/api/audit/resources/ROUTE/r1")
                        .header("Authorization", auditorToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].action").value("DISABLE_ROUTE"));

        mockMvc.perform(get("/api/audit")
                        .param("startDate", "yesterday")
                        .header("Authorization", auditorToken))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_DATE"));
    }

    @Test
    void filtersByActor() throws Exception {
        AuditActor other = new AuditActor(UUID.randomUUID(), "other@taildeck.test", null);
        write(AuditEntry.of(AuditAction.ENABLE_ROUTE, actor, AuditResourceType.ROUTE, "r1"));
        write(AuditEntry.of(AuditAction.ENABLE_ROUTE, other, AuditResourceType.ROUTE, "r2")
                .withNewValue(Map.of("enabled", true)));

        mockMvc.perform(get("/api/audit")
                        .param("userId", other.userId().toString())
                        .header("Authorization", auditorToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.entries[0].resourceId").value("r2"))
                .andExpect(jsonPath("$.entries[0].newValue.enabled").value(true));
    }

    @Test
    @DisplayName("USER 세션은 감사 로그를 볼 수 없다")
    void userCannotReadAuditLog() throws Exception {
        mockMvc.perform(get("/api/audit")
                        .header("Authorization", TestSessions.bearer(jwtTokenService, UUID.randomUUID(), RoleName.USER)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.required.length()").value(4));
    }

    private void write(AuditEntry entry) {
        AuditWriteResult result = auditLogService.logAudit(entry);
        assertThat(result.written()).isTrue();
    }
}
