package com.taildeck.backend.modules.identity;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import com.taildeck.backend.modules.auth.application.AuthService;
import com.taildeck.backend.modules.auth.presentation.dto.LoginResponse;
import com.taildeck.backend.support.ConcurrentLogins;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * 실제 PostgreSQL 행 잠금으로 소유자 지정 경쟁을 검증한다. Docker 가 없으면 건너뛴다.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class OwnerBootstrapPostgresTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("taildeck_test")
            .withUsername("taildeck")
            .withPassword("taildeck");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.datasource.driver-class-name", POSTGRES::getDriverClassName);
    }

    @Autowired
    private AuthService authService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @AfterEach
    void cleanUp() {
        jdbcTemplate.update("delete from audit_log");
        jdbcTemplate.update("delete from user_session");
        jdbcTemplate.update("delete from user_role");
        jdbcTemplate.update("delete from app_user");
    }

    @Test
    void concurrentFirstLoginsProduceSingleOwner() throws Exception {
        List<LoginResponse> responses = ConcurrentLogins.run(authService, 16);

        Integer ownerRows = jdbcTemplate.queryForObject(
                "select count(*) from user_role where role_name = 'OWNER'", Integer.class);
        Integer sessions = jdbcTemplate.queryForObject("select count(*) from user_session", Integer.class);

        assertThat(ownerRows).isEqualTo(1);
        assertThat(sessions).isEqualTo(16);
        assertThat(responses)
                .filteredOn(response -> "OWNER".equals(response.user().effectiveRole()))
                .hasSize(1);
    }
}
