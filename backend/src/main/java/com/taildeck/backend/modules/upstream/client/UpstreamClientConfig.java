package com.taildeck.backend.modules.upstream.client;

import java.net.http.HttpClient;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.DefaultUriBuilderFactory;

@Configuration
public class UpstreamClientConfig {

    @Bean
    public RestClient upstreamRestClient(UpstreamProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.connectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.timeout());
        return restClientBuilder(properties)
                .requestFactory(requestFactory)
                .build();
    }

    /**
     * 요청 팩토리를 제외한 공통 설정. 테스트에서 MockRestServiceServer 를 바인딩할 때도 사용한다.
     */
    public static RestClient.Builder restClientBuilder(UpstreamProperties properties) {
        DefaultUriBuilderFactory uriBuilderFactory = new DefaultUriBuilderFactory(properties.apiBaseUrl());
        uriBuilderFactory.setEncodingMode(DefaultUriBuilderFactory.EncodingMode.TEMPLATE_AND_VALUES);
        return RestClient.builder()
                .uriBuilderFactory(uriBuilderFactory)
                .defaultHeaders(headers -> {
                    headers.setBearerAuth(properties.apiKey() == null ? "" : properties.apiKey());
                    headers.set(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
                });
    }
}
