package com.taildeck.backend.modules.upstream.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record SetPolicyRequest(@NotBlank String policy) {
}
