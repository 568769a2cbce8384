package com.taildeck.backend.modules.upstream.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateUpstreamUserRequest(@NotBlank @Size(max = 63) String name) {
}
