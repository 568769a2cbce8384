package com.taildeck.backend.modules.identity.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record AssignRoleRequest(@NotBlank String role) {
}
