package com.taildeck.backend.modules.upstream.client;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * 운영 설정의 요청 팩토리로 실제 로컬 서버에 붙어 타임아웃 분류를 확인한다.
 */
class UpstreamClientTimeoutTest {

    private HttpServer server;
    private ExecutorService handlerPool;

    @BeforeEach
    void startSlowServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        handlerPool = Executors.newCachedThreadPool();
        server.setExecutor(handlerPool);
        server.createContext("/api/v1/node", exchange -> {
            try {
                Thread.sleep(3_000);
                byte[] body = "{\"nodes\":[]}".getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().add("Content-Type", "application/json");
                exchange.sendResponseHeaders(200, body.length);
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(body);
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } finally {
                exchange.close();
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
        handlerPool.shutdownNow();
    }

    @Test
    @DisplayName("응답이 읽기 타임아웃을 넘기면 재시도 가능한 TIMEOUT 으로 분류한다")
    void slowUpstreamIsClassifiedAsTimeout() {
        UpstreamClient client = clientFor("http://127.0.0.1:" + server.getAddress().getPort());

        long started = System.nanoTime();
        GatewayResult<?> result = client.listNodes();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error().kind()).isEqualTo(GatewayErrorKind.TIMEOUT);
        assertThat(result.error().retryable()).isTrue();
        assertThat(elapsed).isLessThan(Duration.ofSeconds(3));
    }

    @Test
    void refusedConnectionIsClassifiedAsConnectionError() throws IOException {
        int port;
        try (ServerSocket unused = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = unused.getLocalPort();
        }
        UpstreamClient client = clientFor("http://127.0.0.1:" + port);

        GatewayResult<?> result = client.listNodes();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error().kind()).isEqualTo(GatewayErrorKind.CONNECTION_ERROR);
    }

    private static UpstreamClient clientFor(String baseUrl) {
        UpstreamProperties properties = new UpstreamProperties(
                baseUrl, "test-api-key", Duration.ofMillis(500), Duration.ofSeconds(1));
        return new UpstreamClient(new UpstreamClientConfig().upstreamRestClient(properties), new ObjectMapper());
    }
}
