package com.taildeck.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.util.StringUtils;

/**
 * 프록시 헤더 기준 클라이언트 IP 추출. X-Forwarded-For의 첫 항목, 없으면 X-Real-IP를 사용한다.
 */
public final class ClientIpResolver {

    public static final String FORWARDED_FOR = "X-Forwarded-For";
    public static final String REAL_IP = "X-Real-IP";

    private ClientIpResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR);
        if (StringUtils.hasText(forwarded)) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String realIp = request.getHeader(REAL_IP);
        if (StringUtils.hasText(realIp)) {
            return realIp.trim();
        }
        return null;
    }
}
