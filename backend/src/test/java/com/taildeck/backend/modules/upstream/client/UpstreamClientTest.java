package com.taildeck.backend.modules.upstream.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

import com.taildeck.backend.modules.upstream.client.dto.UpstreamNode;
import com.taildeck.backend.modules.upstream.client.dto.UpstreamRoute;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class UpstreamClientTest {

    private static final String BASE = "http://headscale.test/api/v1";

    private MockRestServiceServer server;
    private UpstreamClient client;

    @BeforeEach
    void setUp() {
        UpstreamProperties properties = new UpstreamProperties(
                "http://headscale.test/", "test-api-key", Duration.ofSeconds(2), Duration.ofSeconds(1));
        RestClient.Builder builder = UpstreamClientConfig.restClientBuilder(properties);
        server = MockRestServiceServer.bindTo(builder).build();
        client = new UpstreamClient(builder.build(), new ObjectMapper());
    }

    @Test
    @DisplayName("API 키를 Bearer 헤더로 보내고 응답을 역직렬화한다")
    void listNodesSendsBearerKey() {
        server.expect(requestTo(BASE + "/node"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Bearer test-api-key"))
                .andRespond(withSuccess("""
                        {"nodes":[{"id":"1","name":"laptop","givenName":"alice-laptop",
                                   "user":{"id":"7","name":"alice"},"forcedTags":["tag:dev"],"online":true}]}
                        """, MediaType.APPLICATION_JSON));

        GatewayResult<List<UpstreamNode>> result = client.listNodes();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value()).singleElement().satisfies(node -> {
            assertThat(node.displayName()).isEqualTo("alice-laptop");
            assertThat(node.userName()).isEqualTo("alice");
            assertThat(node.forcedTags()).containsExactly("tag:dev");
        });
        server.verify();
    }

    @Test
    void enableRouteReturnsUpdatedRoute() {
        server.expect(requestTo(BASE + "/routes/r1/enable"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("""
                        {"route":{"id":"r1","prefix":"10.0.0.0/24","enabled":true,"isPrimary":true,
                                  "node":{"id":"3","givenName":"gateway"}}}
                        """, MediaType.APPLICATION_JSON));

        GatewayResult<UpstreamRoute> result = client.enableRoute("r1");

        assertThat(result.value().enabled()).isTrue();
        assertThat(result.value().primary()).isTrue();
        assertThat(result.value().node().displayName()).isEqualTo("gateway");
    }

    @Test
    @DisplayName("쿼리 파라미터 값은 인코딩된다")
    void moveNodeEncodesUserQueryParameter() {
        server.expect(requestTo(BASE + "/node/5/user?user=ops%20team"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"node\":{\"id\":\"5\"}}", MediaType.APPLICATION_JSON));

        assertThat(client.moveNode("5", "ops team").isSuccess()).isTrue();
        server.verify();
    }

    @Test
    void setNodeTagsSendsJsonBody() {
        server.expect(requestTo(BASE + "/node/5/tags"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"tags\":[\"tag:web\",\"tag:prod\"]}"))
                .andRespond(withSuccess("{\"node\":{\"id\":\"5\",\"forcedTags\":[\"tag:web\",\"tag:prod\"]}}",
                        MediaType.APPLICATION_JSON));

        GatewayResult<UpstreamNode> result = client.setNodeTags("5", List.of("tag:web", "tag:prod"));

        assertThat(result.value().forcedTags()).containsExactly("tag:web", "tag:prod");
    }

    @Test
    @DisplayName("404 응답은 NOT_FOUND 로 분류된다")
    void notFoundIsClassified() {
        server.expect(requestTo(BASE + "/node/404"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"code\":5,\"message\":\"node not found\"}"));

        GatewayResult<UpstreamNode> result = client.getNode("404");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error().kind()).isEqualTo(GatewayErrorKind.NOT_FOUND);
        assertThat(result.error().status()).isEqualTo(404);
        assertThat(result.error().retryable()).isFalse();
    }

    @Test
    @DisplayName("400 응답은 업스트림 메시지를 보존한 BAD_REQUEST 로 분류된다")
    void badRequestPreservesUpstreamMessage() {
        server.expect(requestTo(BASE + "/policy"))
                .andExpect(method(HttpMethod.PUT))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"code\":3,\"message\":\"parsing policy: unknown group\"}"));

        GatewayResult<?> result = client.setPolicy("{\"acls\":[]}");

        assertThat(result.error().kind()).isEqualTo(GatewayErrorKind.BAD_REQUEST);
        assertThat(result.error().message()).isEqualTo("parsing policy: unknown group");
        assertThat(result.error().code()).isEqualTo("3");
    }

    @Test
    void otherStatusIsUpstreamError() {
        server.expect(requestTo(BASE + "/user")).andRespond(withServerError());

        GatewayResult<?> result = client.listUsers();

        assertThat(result.error().kind()).isEqualTo(GatewayErrorKind.UPSTREAM_ERROR);
        assertThat(result.error().status()).isEqualTo(500);
        assertThat(result.error().message()).isEqualTo("Internal Server Error");
    }

    @Test
    @DisplayName("읽기 타임아웃은 재시도 가능한 TIMEOUT 이다")
    void readTimeoutIsRetryableTimeout() {
        server.expect(requestTo(BASE + "/routes")).andRespond(request -> {
            throw new SocketTimeoutException("Read timed out");
        });

        GatewayResult<?> result = client.listRoutes();

        assertThat(result.error().kind()).isEqualTo(GatewayErrorKind.TIMEOUT);
        assertThat(result.error().status()).isNull();
        assertThat(result.error().retryable()).isTrue();
    }

    @Test
    void wrappedTimeoutExceptionIsTimeout() {
        server.expect(requestTo(BASE + "/node")).andRespond(request -> {
            throw new IOException("Request timed out", new TimeoutException());
        });

        GatewayResult<?> result = client.listNodes();

        assertThat(result.error().kind()).isEqualTo(GatewayErrorKind.TIMEOUT);
    }

    @Test
    @DisplayName("연결 거부는 재시도 가능한 CONNECTION_ERROR 이다")
    void connectionRefusedIsConnectionError() {
        server.expect(requestTo(BASE + "/apikey")).andRespond(request -> {
            throw new ConnectException("Connection refused");
        });

        GatewayResult<?> result = client.listApiKeys();

        assertThat(result.error().kind()).isEqualTo(GatewayErrorKind.CONNECTION_ERROR);
        assertThat(result.error().retryable()).isTrue();
    }

    @Test
    @DisplayName("빈 본문이나 해석할 수 없는 본문은 UPSTREAM_ERROR 이다")
    void unreadableBodyIsUpstreamError() {
        server.expect(requestTo(BASE + "/node/1")).andRespond(withSuccess());
        server.expect(requestTo(BASE + "/node/2")).andRespond(withSuccess("not-json", MediaType.APPLICATION_JSON));

        assertThat(client.getNode("1").error().kind()).isEqualTo(GatewayErrorKind.UPSTREAM_ERROR);
        assertThat(client.getNode("2").error().kind()).isEqualTo(GatewayErrorKind.UPSTREAM_ERROR);
    }

    @Test
    void deleteWithoutResponseBodySucceeds() {
        server.expect(requestTo(BASE + "/apikey/abc123"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withSuccess());

        assertThat(client.deleteApiKey("abc123").isSuccess()).isTrue();
    }

    @Test
    void createApiKeyOmitsMissingExpiration() {
        server.expect(requestTo(BASE + "/apikey"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{}", true))
                .andRespond(withSuccess("{\"apiKey\":\"hskey-full-secret\"}", MediaType.APPLICATION_JSON));

        assertThat(client.createApiKey(null).value()).isEqualTo("hskey-full-secret");
    }
}
