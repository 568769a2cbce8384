package com.taildeck.backend.modules.upstream.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record ExpirePreAuthKeyRequest(@NotBlank String user, @NotBlank String key) {
}
