package com.taildeck.backend.support;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import io.jsonwebtoken.Jwts;

/**
 * application-test.yml 의 ID 제공자 설정으로 서명한 ID 토큰을 만든다.
 */
public final class TestIdentityTokens {

    public static final String ISSUER = "https://idp.test/application/o/taildeck/";
    public static final String SECRET = "test-taildeck-identity-provider-secret-0123456789";

    private TestIdentityTokens() {
    }

    public static String identityToken(String subject, String email, String name, List<String> groups) {
        return identityToken(subject, email, name, groups, ISSUER, SECRET);
    }

    public static String identityToken(String subject, String email, String name, List<String> groups,
                                       String issuer, String secret) {
        Instant now = Instant.now();
        return Jwts.builder()
                .subject(subject)
                .issuer(issuer)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(Duration.ofMinutes(5))))
                .claim("email", email)
                .claim("name", name)
                .claim("groups", groups)
                .signWith(key(secret), Jwts.SIG.HS256)
                .compact();
    }

    private static SecretKey key(String secret) {
        return new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
    }
}
