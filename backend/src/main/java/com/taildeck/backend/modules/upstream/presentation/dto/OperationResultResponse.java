package com.taildeck.backend.modules.upstream.presentation.dto;

public record OperationResultResponse(boolean success) {

    public static OperationResultResponse ok() {
        return new OperationResultResponse(true);
    }
}
