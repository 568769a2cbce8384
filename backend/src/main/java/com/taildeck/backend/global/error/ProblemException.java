package com.taildeck.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * 핸들러가 클라이언트에 오류를 알리는 표준 예외.
 * {@code detail}은 응답의 {@code error} 필드, {@code message}는 선택적인 부가 설명이 된다.
 */
public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String detail;
    private final String message;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, null);
    }

    public ProblemException(HttpStatus status, String code, String detail, String message) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : status.getReasonPhrase();
        this.message = (message != null && !message.isBlank()) ? message : null;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getAdditionalMessage() {
        return message;
    }
}
