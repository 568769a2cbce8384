package com.taildeck.backend.modules.upstream.application;

import static org.assertj.core.api.Assertions.assertThat;

import com.taildeck.backend.global.error.ProblemException;
import com.taildeck.backend.global.error.RetryableProblemException;
import com.taildeck.backend.modules.upstream.client.GatewayError;
import com.taildeck.backend.modules.upstream.client.GatewayErrorKind;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class GatewayErrorTranslatorTest {

    private final GatewayErrorTranslator translator = new GatewayErrorTranslator();

    @Test
    @DisplayName("타임아웃은 Retry-After 가 붙은 503 이다")
    void timeoutIsRetryable503() {
        ProblemException problem = translator.translate(GatewayError.timeout("Request timed out"), "Node");

        assertThat(problem).isInstanceOf(RetryableProblemException.class);
        assertThat(problem.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(problem.getDetailMessage()).isEqualTo("Service temporarily unavailable");
        assertThat(((RetryableProblemException) problem).getRetryAfterSeconds())
                .isEqualTo(GatewayErrorTranslator.RETRY_AFTER_SECONDS);
    }

    @Test
    void connectionErrorIsRetryable503() {
        ProblemException problem = translator.translate(GatewayError.connectionError("refused"), "Node");

        assertThat(problem).isInstanceOf(RetryableProblemException.class);
        assertThat(problem.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(problem.getDetailMessage()).isEqualTo("Unable to connect to Headscale");
    }

    @Test
    @DisplayName("404 는 리소스 이름을 담은 not found 로 변환된다")
    void notFoundNamesTheResource() {
        ProblemException problem = translator.translate(
                new GatewayError(GatewayErrorKind.NOT_FOUND, 404, "record not found", null), "Route");

        assertThat(problem.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(problem.getDetailMessage()).isEqualTo("Route not found");
        assertThat(problem).isNotInstanceOf(RetryableProblemException.class);
    }

    @Test
    @DisplayName("400 은 업스트림 메시지를 그대로 전달한다")
    void badRequestKeepsUpstreamMessage() {
        ProblemException problem = translator.translate(
                new GatewayError(GatewayErrorKind.BAD_REQUEST, 400, "invalid tag format", "3"), "Node");

        assertThat(problem.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(problem.getDetailMessage()).isEqualTo("invalid tag format");
        assertThat(problem.getCode()).isEqualTo("UPSTREAM_REJECTED");
    }

    @Test
    void otherUpstreamFailuresAreBadGateway() {
        ProblemException problem = translator.translate(
                new GatewayError(GatewayErrorKind.UPSTREAM_ERROR, 500, "Internal Server Error", null), "Node");

        assertThat(problem.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(problem.getDetailMessage()).isEqualTo("Failed to complete operation");
    }

    @Test
    void everyKindIsTranslated() {
        for (GatewayErrorKind kind : GatewayErrorKind.values()) {
            ProblemException problem = translator.translate(new GatewayError(kind, null, "x", null), "Node");
            assertThat(problem.getStatusCode().is4xxClientError() || problem.getStatusCode().is5xxServerError())
                    .as(kind.name())
                    .isTrue();
            assertThat(problem instanceof RetryableProblemException).as(kind.name()).isEqualTo(kind.retryable());
        }
    }
}
