package com.example.auth.api.response;

public record SignupSettingResponse(boolean enabled) {}
