package com.taildeck.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 세션 토큰 서명용 시크릿 키 래퍼.
 */
@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secretString) {
        this.secretKey = toSecretKey(secretString);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    /**
     * Base64로 해석 가능하면 디코딩한 바이트를, 아니면 UTF-8 바이트를 키로 사용한다.
     */
    public static SecretKey toSecretKey(String secretString) {
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            keyBytes = secretString.getBytes(StandardCharsets.UTF_8);
        }
        return new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }
}
