/*
 * どこで: app/auth/src/main/java/com/example/auth/model/SessionClaims.java
 * 何を: 発行トークンに埋め込む最小 claims
 * なぜ: 後続リクエストでユーザーを再同定するには id だけで足りるため
 */
package com.example.auth.model;

public record SessionClaims(String id) {
}
