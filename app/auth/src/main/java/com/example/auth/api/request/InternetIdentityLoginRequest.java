/*
 * どこで: app/auth/src/main/java/com/example/auth/api/request/InternetIdentityLoginRequest.java
 * 何を: POST /auth/internet-identity の入力 DTO
 * なぜ: Internet Identity の principal id を受け取るため
 */
package com.example.auth.api.request;

import jakarta.validation.constraints.NotBlank;

public record InternetIdentityLoginRequest(
        @NotBlank(message = "principalId is required") String principalId) {
}
