/*
 * どこで: app/auth/src/main/java/com/example/auth/api/response/AuthTokenResponse.java
 * 何を: ログイン成功時の出力 DTO
 * なぜ: 発行した署名付きトークンだけを返す契約にするため
 */
package com.example.auth.api.response;

public record AuthTokenResponse(String authToken) {
}
