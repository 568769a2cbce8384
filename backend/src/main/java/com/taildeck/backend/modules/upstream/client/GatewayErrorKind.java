package com.taildeck.backend.modules.upstream.client;

public enum GatewayErrorKind {
    TIMEOUT(true),
    CONNECTION_ERROR(true),
    NOT_FOUND(false),
    BAD_REQUEST(false),
    UPSTREAM_ERROR(false);

    private final boolean retryable;

    GatewayErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
