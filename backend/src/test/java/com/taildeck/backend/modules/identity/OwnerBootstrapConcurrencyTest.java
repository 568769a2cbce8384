package com.taildeck.backend.modules.identity;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import com.taildeck.backend.modules.auth.application.AuthService;
import com.taildeck.backend.modules.auth.presentation.dto.LoginResponse;
import com.taildeck.backend.support.AbstractIntegrationTest;
import com.taildeck.backend.support.ConcurrentLogins;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class OwnerBootstrapConcurrencyTest extends AbstractIntegrationTest {

    @Autowired
    private AuthService authService;

    @Test
    @DisplayName("동시에 최초 로그인해도 소유자는 정확히 한 명이다")
    void concurrentFirstLoginsProduceSingleOwner() throws Exception {
        List<LoginResponse> responses = ConcurrentLogins.run(authService, 8);

        long ownersInResponses = responses.stream()
                .filter(response -> "OWNER".equals(response.user().effectiveRole()))
                .count();
        Integer ownerRows = jdbcTemplate.queryForObject(
                "select count(*) from user_role where role_name = 'OWNER'", Integer.class);

        assertThat(ownerRows).isEqualTo(1);
        assertThat(ownersInResponses).isEqualTo(1);
        assertThat(responses).allSatisfy(response -> assertThat(response.user().roles()).contains("USER"));
    }
}
