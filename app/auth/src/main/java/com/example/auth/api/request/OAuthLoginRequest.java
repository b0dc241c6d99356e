package com.example.auth.api.request;

import com.example.auth.model.AuthProvider;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record OAuthLoginRequest(
    @NotNull(message = "provider is required") AuthProvider provider,
    @NotBlank(message = "thirdPartyId is required") String thirdPartyId) {}
