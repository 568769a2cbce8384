package com.taildeck.backend.modules.auth.presentation.dto;

public record LoginResponse(TokenPairResponse tokens, UserProfileResponse user) {
}
