package com.taildeck.backend.modules.upstream.client;

import java.util.Objects;
import java.util.function.Function;

/**
 * 업스트림 호출 결과. 성공 값 또는 {@link GatewayError} 중 하나만 가진다.
 */
public final class GatewayResult<T> {

    private final T value;
    private final GatewayError error;

    private GatewayResult(T value, GatewayError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> GatewayResult<T> success(T value) {
        return new GatewayResult<>(value, null);
    }

    public static <T> GatewayResult<T> failure(GatewayError error) {
        return new GatewayResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T value() {
        if (error != null) {
            throw new IllegalStateException("failed result has no value: " + error.kind());
        }
        return value;
    }

    public GatewayError error() {
        if (error == null) {
            throw new IllegalStateException("successful result has no error");
        }
        return error;
    }

    public <R> GatewayResult<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    public <X extends RuntimeException> T orElseThrow(Function<GatewayError, X> exceptionMapper) {
        if (error != null) {
            throw exceptionMapper.apply(error);
        }
        return value;
    }

    @Override
    public String toString() {
        return error == null ? "GatewayResult[success]" : "GatewayResult[" + error.kind() + "]";
    }
}
