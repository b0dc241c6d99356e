/*
 * どこで: app/auth/src/main/java/com/example/auth/api/ApiErrorResponse.java
 * 何を: API エラー応答の共通 DTO
 * なぜ: 呼び出し側がコードだけで分岐できるようにするため
 */
package com.example.auth.api;

public record ApiErrorResponse(
        ApiErrorCode code,
        String message) {
}
