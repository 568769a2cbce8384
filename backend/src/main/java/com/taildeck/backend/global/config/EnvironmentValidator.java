package com.taildeck.backend.global.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 시작 시 필수 설정 검증.
 * 누락되거나 잘못된 값이 있으면 기동을 중단한다.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEFAULT_JWT_SECRET = "dev-taildeck-jwt-secret-change-in-production";
    private static final int MIN_SECRET_LENGTH = 32;

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "app.identity.issuer",
            "app.identity.secret",
            "app.upstream.base-url",
            "app.upstream.api-key",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missing = new ArrayList<>();
        List<String> invalid = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            String value = Optional.ofNullable(environment.getProperty(property)).map(String::trim).orElse("");
            if (value.isEmpty()) {
                missing.add(property);
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(secret -> !secret.isBlank() && secret.length() < MIN_SECRET_LENGTH)
                .ifPresent(secret -> invalid.add("jwt.secret: 최소 " + MIN_SECRET_LENGTH + "자 이상이어야 합니다"));

        if (DEFAULT_JWT_SECRET.equals(environment.getProperty("jwt.secret"))
                && !environment.matchesProfiles("local", "test")) {
            invalid.add("jwt.secret: 기본값을 실제 랜덤 문자열로 변경하세요");
        }

        validateDuration("jwt.refresh-interval", invalid);
        validateDuration("jwt.session-max-age", invalid);
        validateDuration("app.upstream.timeout", invalid);
        validateDuration("app.upstream.connect-timeout", invalid);

        if (!missing.isEmpty() || !invalid.isEmpty()) {
            if (!missing.isEmpty()) {
                log.error("Missing required properties: {}", String.join(", ", missing));
            }
            invalid.forEach(problem -> log.error("Invalid property value: {}", problem));
            throw new IllegalStateException("Environment validation failed (missing=" + missing
                    + ", invalid=" + invalid + ")");
        }

        log.info("Environment validation passed");
    }

    private void validateDuration(String property, List<String> invalid) {
        String raw = environment.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            Duration duration = Duration.parse(raw.trim());
            if (duration.isNegative() || duration.isZero()) {
                invalid.add(property + ": 0보다 커야 합니다");
            }
        } catch (DateTimeParseException ex) {
            // Spring Boot의 "30s" 같은 간이 표기는 ConfigurationProperties 바인딩에서 검증된다
            if (!raw.trim().matches("\\d+(ms|s|m|h|d)")) {
                invalid.add(property + ": ISO-8601 기간 형식이어야 합니다");
            }
        }
    }
}
