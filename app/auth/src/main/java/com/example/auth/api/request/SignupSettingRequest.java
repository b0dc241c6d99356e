package com.example.auth.api.request;

import jakarta.validation.constraints.NotNull;

public record SignupSettingRequest(@NotNull(message = "enabled is required") Boolean enabled) {}
