package com.taildeck.backend.modules.auth.application;

import java.time.Clock;
import java.util.Date;
import java.util.List;
import java.util.Objects;

import javax.crypto.SecretKey;

import com.taildeck.backend.global.error.ProblemException;
import com.taildeck.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.taildeck.backend.modules.identity.domain.ExternalIdentity;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * ID 제공자가 서명한 토큰(HS256)을 검증하고 신원 정보를 꺼낸다.
 * 발급자(iss)가 설정값과 다르면 거부한다.
 */
@Component
public class IdentityTokenVerifier {

    private static final Logger log = LoggerFactory.getLogger(IdentityTokenVerifier.class);

    private final SecretKey key;
    private final String issuer;
    private final Clock clock;

    public IdentityTokenVerifier(
            @Value("${app.identity.secret}") String secret,
            @Value("${app.identity.issuer}") String issuer,
            Clock clock
    ) {
        // 비어 있으면 EnvironmentValidator 가 기동을 중단시킨다
        this.key = secret == null || secret.isBlank() ? null : JwtTokenProvider.toSecretKey(secret);
        this.issuer = issuer;
        this.clock = clock;
    }

    public ExternalIdentity verify(String identityToken) {
        if (key == null) {
            log.error("Identity token verification is not configured (app.identity.secret is empty)");
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_IDENTITY_TOKEN", "Unauthorized",
                    "Identity token could not be verified");
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(identityToken)
                    .getPayload();

            String name = claims.get("name", String.class);
            if (name == null) {
                name = claims.get("preferred_username", String.class);
            }
            List<?> groupsClaim = claims.get("groups", List.class);
            List<String> groups = groupsClaim == null ? List.of() : groupsClaim.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .toList();

            return new ExternalIdentity(claims.getSubject(), claims.get("email", String.class), name, groups);
        } catch (JwtException | IllegalArgumentException ex) {
            log.info("Identity token rejected: {}", ex.getMessage());
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_IDENTITY_TOKEN", "Unauthorized",
                    "Identity token could not be verified");
        }
    }
}
