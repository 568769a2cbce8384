package com.taildeck.backend.global.error;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.slf4j.MDC;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProblemResponse(
        String error,
        String message,
        String code,
        List<String> required,
        String requiredLevel,
        List<String> validValues,
        String requestId
) {

    public static final String REQUEST_ID_MDC_KEY = "requestId";

    public static ProblemResponse of(String error, String code) {
        return of(error, null, code);
    }

    public static ProblemResponse of(String error, String message, String code) {
        return new ProblemResponse(error, message, code, null, null, null, currentRequestId());
    }

    public ProblemResponse withRequired(List<String> requiredRoles) {
        return new ProblemResponse(error, message, code, requiredRoles, requiredLevel, validValues, requestId);
    }

    public ProblemResponse withRequiredLevel(String level) {
        return new ProblemResponse(error, message, code, required, level, validValues, requestId);
    }

    public ProblemResponse withValidValues(List<String> values) {
        return new ProblemResponse(error, message, code, required, requiredLevel, values, requestId);
    }

    private static String currentRequestId() {
        return MDC.get(REQUEST_ID_MDC_KEY);
    }
}
