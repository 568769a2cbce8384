package com.taildeck.backend.modules.upstream.client;

import java.util.Objects;

/**
 * 업스트림 호출 실패. status 는 업스트림 HTTP 상태이며 전송 계층 실패일 때는 null 이다.
 */
public record GatewayError(GatewayErrorKind kind, Integer status, String message, String code) {

    public GatewayError {
        Objects.requireNonNull(kind, "kind");
    }

    public static GatewayError timeout(String message) {
        return new GatewayError(GatewayErrorKind.TIMEOUT, null, message, null);
    }

    public static GatewayError connectionError(String message) {
        return new GatewayError(GatewayErrorKind.CONNECTION_ERROR, null, message, null);
    }

    public boolean retryable() {
        return kind.retryable();
    }
}
