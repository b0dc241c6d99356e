/*
 * どこで: app/auth/src/main/java/com/example/auth/model/AuthProvider.java
 * 何を: ユーザーを外部から同定する provider の列挙型
 * なぜ: users.provider 列と OAuth 入力を同じ閉じた集合で扱うため
 */
package com.example.auth.model;

public enum AuthProvider {
    ANONYMOUS,
    GOOGLE,
    INTERNET_IDENTITY,
    OIDC
}
