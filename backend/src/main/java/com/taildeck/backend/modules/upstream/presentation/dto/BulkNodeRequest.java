package com.taildeck.backend.modules.upstream.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record BulkNodeRequest(
        @NotBlank String action,
        @NotNull @Size(min = 1, max = 100) List<@NotBlank String> nodeIds,
        String newUser,
        List<@NotBlank String> tags
) {
}
