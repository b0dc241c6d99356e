/*
 * どこで: Auth API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.auth.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    UNAUTHENTICATED,
    SIGNUP_DISABLED,
    DIRECTORY_INTEGRITY_VIOLATION,
    DIRECTORY_UNAVAILABLE,
    INTERNAL_ERROR
}
