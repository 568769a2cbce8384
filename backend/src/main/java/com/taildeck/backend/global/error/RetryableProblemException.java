package com.taildeck.backend.global.error;

import org.springframework.http.HttpStatus;

public class RetryableProblemException extends ProblemException {

    private final int retryAfterSeconds;

    public RetryableProblemException(HttpStatus status, String code, String detail, int retryAfterSeconds) {
        this(status, code, detail, null, retryAfterSeconds);
    }

    public RetryableProblemException(HttpStatus status, String code, String detail, String message,
                                     int retryAfterSeconds) {
        super(status, code, detail, message);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
