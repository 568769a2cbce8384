package com.taildeck.backend.modules.upstream.client.dto;

/**
 * 전체 API 키는 생성 응답에서 한 번만 반환된다.
 */
public record ApiKeyCreatedResponse(String apiKey) {
}
