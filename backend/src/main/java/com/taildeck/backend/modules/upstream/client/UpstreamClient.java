package com.taildeck.backend.modules.upstream.client;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.concurrent.TimeoutException;

import com.taildeck.backend.modules.upstream.client.dto.ApiKey;
import com.taildeck.backend.modules.upstream.client.dto.ApiKeyCreatedResponse;
import com.taildeck.backend.modules.upstream.client.dto.ApiKeyListResponse;
import com.taildeck.backend.modules.upstream.client.dto.DnsResponse;
import com.taildeck.backend.modules.upstream.client.dto.NodeListResponse;
import com.taildeck.backend.modules.upstream.client.dto.NodeResponse;
import com.taildeck.backend.modules.upstream.client.dto.PolicyResponse;
import com.taildeck.backend.modules.upstream.client.dto.PreAuthKey;
import com.taildeck.backend.modules.upstream.client.dto.PreAuthKeyListResponse;
import com.taildeck.backend.modules.upstream.client.dto.PreAuthKeyResponse;
import com.taildeck.backend.modules.upstream.client.dto.RouteListResponse;
import com.taildeck.backend.modules.upstream.client.dto.RouteResponse;
import com.taildeck.backend.modules.upstream.client.dto.UpstreamNode;
import com.taildeck.backend.modules.upstream.client.dto.UpstreamRequests;
import com.taildeck.backend.modules.upstream.client.dto.UpstreamRoute;
import com.taildeck.backend.modules.upstream.client.dto.UpstreamUser;
import com.taildeck.backend.modules.upstream.client.dto.UserListResponse;
import com.taildeck.backend.modules.upstream.client.dto.UserResponse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Headscale REST API 클라이언트.
 * 모든 호출은 예외 대신 {@link GatewayResult} 를 반환한다.
 */
@Component
public class UpstreamClient {

    private static final Logger log = LoggerFactory.getLogger(UpstreamClient.class);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public UpstreamClient(@Qualifier("upstreamRestClient") RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    // 노드

    public GatewayResult<List<UpstreamNode>> listNodes() {
        return call("GET /node", HttpMethod.GET, null, NodeListResponse.class, "/node")
                .map(NodeListResponse::nodes);
    }

    public GatewayResult<UpstreamNode> getNode(String nodeId) {
        return call("GET /node/{id}", HttpMethod.GET, null, NodeResponse.class, "/node/{id}", nodeId)
                .map(NodeResponse::node);
    }

    public GatewayResult<UpstreamNode> renameNode(String nodeId, String newName) {
        return call("POST /node/{id}/rename", HttpMethod.POST, null, NodeResponse.class,
                "/node/{id}/rename/{name}", nodeId, newName)
                .map(NodeResponse::node);
    }

    public GatewayResult<UpstreamNode> setNodeTags(String nodeId, List<String> tags) {
        return call("POST /node/{id}/tags", HttpMethod.POST, new UpstreamRequests.SetTags(tags),
                NodeResponse.class, "/node/{id}/tags", nodeId)
                .map(NodeResponse::node);
    }

    public GatewayResult<UpstreamNode> moveNode(String nodeId, String user) {
        return call("POST /node/{id}/user", HttpMethod.POST, null, NodeResponse.class,
                "/node/{id}/user?user={user}", nodeId, user)
                .map(NodeResponse::node);
    }

    public GatewayResult<UpstreamNode> expireNode(String nodeId) {
        return call("POST /node/{id}/expire", HttpMethod.POST, null, NodeResponse.class,
                "/node/{id}/expire", nodeId)
                .map(NodeResponse::node);
    }

    public GatewayResult<Void> deleteNode(String nodeId) {
        return callWithoutBody("DELETE /node/{id}", HttpMethod.DELETE, null, "/node/{id}", nodeId);
    }

    // 사용자

    public GatewayResult<List<UpstreamUser>> listUsers() {
        return call("GET /user", HttpMethod.GET, null, UserListResponse.class, "/user")
                .map(UserListResponse::users);
    }

    public GatewayResult<UpstreamUser> createUser(String name) {
        return call("POST /user", HttpMethod.POST, new UpstreamRequests.CreateUser(name),
                UserResponse.class, "/user")
                .map(UserResponse::user);
    }

    public GatewayResult<UpstreamUser> renameUser(String oldName, String newName) {
        return call("POST /user/{name}/rename", HttpMethod.POST, null, UserResponse.class,
                "/user/{oldName}/rename/{newName}", oldName, newName)
                .map(UserResponse::user);
    }

    public GatewayResult<Void> deleteUser(String name) {
        return callWithoutBody("DELETE /user/{name}", HttpMethod.DELETE, null, "/user/{name}", name);
    }

    // 라우트

    public GatewayResult<List<UpstreamRoute>> listRoutes() {
        return call("GET /routes", HttpMethod.GET, null, RouteListResponse.class, "/routes")
                .map(RouteListResponse::routes);
    }

    public GatewayResult<UpstreamRoute> enableRoute(String routeId) {
        return call("POST /routes/{id}/enable", HttpMethod.POST, null, RouteResponse.class,
                "/routes/{id}/enable", routeId)
                .map(RouteResponse::route);
    }

    public GatewayResult<UpstreamRoute> disableRoute(String routeId) {
        return call("POST /routes/{id}/disable", HttpMethod.POST, null, RouteResponse.class,
                "/routes/{id}/disable", routeId)
                .map(RouteResponse::route);
    }

    public GatewayResult<Void> deleteRoute(String routeId) {
        return callWithoutBody("DELETE /routes/{id}", HttpMethod.DELETE, null, "/routes/{id}", routeId);
    }

    // 사전 인증 키

    public GatewayResult<List<PreAuthKey>> listPreAuthKeys(String user) {
        return call("GET /preauthkey", HttpMethod.GET, null, PreAuthKeyListResponse.class,
                "/preauthkey?user={user}", user)
                .map(PreAuthKeyListResponse::preAuthKeys);
    }

    public GatewayResult<PreAuthKey> createPreAuthKey(UpstreamRequests.CreatePreAuthKey request) {
        return call("POST /preauthkey", HttpMethod.POST, request, PreAuthKeyResponse.class, "/preauthkey")
                .map(PreAuthKeyResponse::preAuthKey);
    }

    public GatewayResult<Void> expirePreAuthKey(String user, String key) {
        return callWithoutBody("POST /preauthkey/expire", HttpMethod.POST,
                new UpstreamRequests.ExpirePreAuthKey(user, key), "/preauthkey/expire");
    }

    // ACL 정책

    public GatewayResult<PolicyResponse> getPolicy() {
        return call("GET /policy", HttpMethod.GET, null, PolicyResponse.class, "/policy");
    }

    public GatewayResult<PolicyResponse> setPolicy(String policy) {
        return call("PUT /policy", HttpMethod.PUT, new UpstreamRequests.SetPolicy(policy),
                PolicyResponse.class, "/policy");
    }

    // API 키

    public GatewayResult<List<ApiKey>> listApiKeys() {
        return call("GET /apikey", HttpMethod.GET, null, ApiKeyListResponse.class, "/apikey")
                .map(ApiKeyListResponse::apiKeys);
    }

    public GatewayResult<String> createApiKey(String expiration) {
        return call("POST /apikey", HttpMethod.POST, new UpstreamRequests.CreateApiKey(expiration),
                ApiKeyCreatedResponse.class, "/apikey")
                .map(ApiKeyCreatedResponse::apiKey);
    }

    public GatewayResult<Void> expireApiKey(String prefix) {
        return callWithoutBody("POST /apikey/expire", HttpMethod.POST,
                new UpstreamRequests.ExpireApiKey(prefix), "/apikey/expire");
    }

    public GatewayResult<Void> deleteApiKey(String prefix) {
        return callWithoutBody("DELETE /apikey/{prefix}", HttpMethod.DELETE, null, "/apikey/{prefix}", prefix);
    }

    // DNS

    public GatewayResult<DnsResponse> getDns() {
        return call("GET /dns", HttpMethod.GET, null, DnsResponse.class, "/dns");
    }

    public GatewayResult<DnsResponse> setDns(UpstreamRequests.SetDns request) {
        return call("PUT /dns", HttpMethod.PUT, request, DnsResponse.class, "/dns");
    }

    private <T> GatewayResult<T> call(
            String operation,
            HttpMethod method,
            Object body,
            Class<T> responseType,
            String uriTemplate,
            Object... uriVariables
    ) {
        try {
            T response = request(method, body, uriTemplate, uriVariables).retrieve().body(responseType);
            if (response == null) {
                log.error("Headscale {} returned an empty body", operation);
                return GatewayResult.failure(new GatewayError(
                        GatewayErrorKind.UPSTREAM_ERROR, null, "Empty response from Headscale", null));
            }
            return GatewayResult.success(response);
        } catch (RestClientException ex) {
            return GatewayResult.failure(classify(operation, ex));
        }
    }

    private GatewayResult<Void> callWithoutBody(
            String operation,
            HttpMethod method,
            Object body,
            String uriTemplate,
            Object... uriVariables
    ) {
        try {
            request(method, body, uriTemplate, uriVariables).retrieve().toBodilessEntity();
            return GatewayResult.success(null);
        } catch (RestClientException ex) {
            return GatewayResult.failure(classify(operation, ex));
        }
    }

    private RestClient.RequestBodySpec request(HttpMethod method, Object body, String uriTemplate, Object... uriVariables) {
        RestClient.RequestBodySpec spec = restClient.method(method).uri(uriTemplate, uriVariables);
        if (body != null) {
            spec.contentType(MediaType.APPLICATION_JSON).body(body);
        }
        return spec;
    }

    GatewayError classify(String operation, RestClientException ex) {
        if (ex instanceof RestClientResponseException responseException) {
            return classifyResponse(operation, responseException);
        }
        if (ex instanceof ResourceAccessException) {
            if (isTimeout(ex)) {
                log.warn("Headscale {} timed out: {}", operation, ex.getMessage());
                return GatewayError.timeout("Request timed out");
            }
            log.warn("Headscale {} connection failed: {}", operation, ex.getMessage());
            return GatewayError.connectionError("Unable to connect to Headscale");
        }
        log.error("Headscale {} failed unexpectedly", operation, ex);
        return new GatewayError(GatewayErrorKind.UPSTREAM_ERROR, null, "Unexpected response from Headscale", null);
    }

    private GatewayError classifyResponse(String operation, RestClientResponseException ex) {
        int status = ex.getStatusCode().value();
        String upstreamMessage = null;
        String upstreamCode = null;
        try {
            String responseBody = ex.getResponseBodyAsString();
            if (!responseBody.isBlank()) {
                JsonNode node = objectMapper.readTree(responseBody);
                upstreamMessage = textOrNull(node, "message");
                upstreamCode = textOrNull(node, "code");
            }
        } catch (IOException parseFailure) {
            log.debug("Headscale {} error body is not JSON", operation);
        }
        String message = upstreamMessage != null ? upstreamMessage : reasonPhrase(status);

        if (status == HttpStatus.NOT_FOUND.value()) {
            log.warn("Headscale {} returned 404: {}", operation, message);
            return new GatewayError(GatewayErrorKind.NOT_FOUND, status, message, upstreamCode);
        }
        if (status == HttpStatus.BAD_REQUEST.value()) {
            log.warn("Headscale {} returned 400: {}", operation, message);
            return new GatewayError(GatewayErrorKind.BAD_REQUEST, status, message, upstreamCode);
        }
        log.error("Headscale {} returned {}: {}", operation, status, message);
        return new GatewayError(GatewayErrorKind.UPSTREAM_ERROR, status, message, upstreamCode);
    }

    private static boolean isTimeout(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            // JdkClientHttpRequestFactory 의 읽기 타임아웃은 TimeoutException 으로 끝난다
            if (current instanceof SocketTimeoutException
                    || current instanceof HttpTimeoutException
                    || current instanceof TimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String textOrNull(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static String reasonPhrase(int status) {
        HttpStatus resolved = HttpStatus.resolve(status);
        return resolved != null ? resolved.getReasonPhrase() : "HTTP " + status;
    }
}
