package com.taildeck.backend.modules.upstream.application;

import com.taildeck.backend.global.error.ProblemException;
import com.taildeck.backend.global.error.RetryableProblemException;
import com.taildeck.backend.modules.upstream.client.GatewayError;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * {@link GatewayError} 를 클라이언트 응답용 {@link ProblemException} 으로 변환한다.
 */
@Component
public class GatewayErrorTranslator {

    public static final int RETRY_AFTER_SECONDS = 5;

    public ProblemException translate(GatewayError error, String resource) {
        return switch (error.kind()) {
            case TIMEOUT -> new RetryableProblemException(HttpStatus.SERVICE_UNAVAILABLE, "UPSTREAM_TIMEOUT",
                    "Service temporarily unavailable", RETRY_AFTER_SECONDS);
            case CONNECTION_ERROR -> new RetryableProblemException(HttpStatus.SERVICE_UNAVAILABLE,
                    "UPSTREAM_UNAVAILABLE", "Unable to connect to Headscale", RETRY_AFTER_SECONDS);
            case NOT_FOUND -> new ProblemException(HttpStatus.NOT_FOUND, "UPSTREAM_NOT_FOUND", resource + " not found");
            case BAD_REQUEST -> new ProblemException(HttpStatus.BAD_REQUEST, "UPSTREAM_REJECTED",
                    error.message() != null ? error.message() : "Invalid request");
            case UPSTREAM_ERROR -> new ProblemException(HttpStatus.BAD_GATEWAY, "UPSTREAM_ERROR",
                    "Failed to complete operation", error.message());
        };
    }

    /**
     * 일괄 작업 결과에 담길 짧은 실패 사유.
     */
    public String describe(GatewayError error) {
        return switch (error.kind()) {
            case TIMEOUT -> "Request timed out";
            case CONNECTION_ERROR -> "Unable to connect to Headscale";
            case NOT_FOUND, BAD_REQUEST, UPSTREAM_ERROR ->
                    error.message() != null ? error.message() : error.kind().name();
        };
    }
}
