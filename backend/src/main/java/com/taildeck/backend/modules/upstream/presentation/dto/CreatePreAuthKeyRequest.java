package com.taildeck.backend.modules.upstream.presentation.dto;

import java.util.List;

import com.taildeck.backend.modules.upstream.application.CreatePreAuthKeyCommand;

import jakarta.validation.constraints.NotBlank;

public record CreatePreAuthKeyRequest(
        @NotBlank String user,
        Boolean reusable,
        Boolean ephemeral,
        String expiration,
        List<String> aclTags
) {

    public CreatePreAuthKeyCommand toCommand() {
        return new CreatePreAuthKeyCommand(
                user,
                Boolean.TRUE.equals(reusable),
                Boolean.TRUE.equals(ephemeral),
                expiration,
                aclTags
        );
    }
}
