/*
 * どこで: app/auth/src/main/java/com/example/auth/api/request/AnonymousLoginRequest.java
 * 何を: POST /auth/anonymous の入力 DTO
 * なぜ: 生のアクセストークンを API 境界で受け取る形を固定するため
 */
package com.example.auth.api.request;

import jakarta.validation.constraints.NotBlank;

public record AnonymousLoginRequest(
        @NotBlank(message = "accessToken is required") String accessToken) {

    @Override
    public String toString() {
        return "AnonymousLoginRequest[accessToken=***]";
    }
}
