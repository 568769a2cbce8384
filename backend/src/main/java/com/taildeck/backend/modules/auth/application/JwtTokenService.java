package com.taildeck.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.taildeck.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.taildeck.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.taildeck.backend.modules.rbac.domain.RoleName;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import javax.crypto.SecretKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    private final JwtTokenProvider tokenProvider;
    private final Duration refreshInterval;
    private final Duration sessionMaxAge;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.refresh-interval:PT24H}") Duration refreshInterval,
            @Value("${jwt.session-max-age:P30D}") Duration sessionMaxAge,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.refreshInterval = refreshInterval;
        this.sessionMaxAge = sessionMaxAge;
        this.clock = clock;
    }

    /**
     * 액세스 토큰 만료는 발급 시각 + 갱신 주기. refreshToken이 null이면 갱신 불가 세션이다.
     */
    public TokenPairResponse issueTokens(UUID userId, String email, String name, Set<RoleName> roles, String refreshToken) {
        Instant now = clock.instant();
        OffsetDateTime issuedAt = OffsetDateTime.ofInstant(now, clock.getZone());
        Instant accessExpiry = now.plus(refreshInterval);

        SecretKey key = tokenProvider.getSecretKey();

        String accessToken = Jwts.builder()
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(accessExpiry))
                .claim("email", email)
                .claim("name", name)
                .claim("roles", roles.stream().map(Enum::name).sorted().toList())
                .signWith(key, SIG.HS256)
                .compact();

        return new TokenPairResponse(
                accessToken,
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                refreshInterval.toSeconds(),
                refreshToken,
                refreshToken != null ? sessionMaxAge.toSeconds() : null,
                issuedAt
        );
    }

    public SessionClaims parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            UUID userId = UUID.fromString(claims.getSubject());
            List<?> rolesClaim = claims.get("roles", List.class);
            Set<RoleName> roles = EnumSet.noneOf(RoleName.class);
            if (rolesClaim != null) {
                for (Object raw : rolesClaim) {
                    roles.add(RoleName.parse(raw == null ? null : raw.toString())
                            .orElseThrow(() -> new IllegalArgumentException("Unknown role in token: " + raw)));
                }
            }
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new SessionClaims(
                    userId,
                    claims.get("email", String.class),
                    claims.get("name", String.class),
                    roles,
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public Duration getRefreshInterval() {
        return refreshInterval;
    }

    public Duration getSessionMaxAge() {
        return sessionMaxAge;
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
