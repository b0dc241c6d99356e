/*
 * どこで: app/auth/src/main/java/com/example/auth/model/ProviderIdentity.java
 * 何を: provider + thirdPartyId の組
 * なぜ: 検索キーとユーザー作成時のペイロードを同じ値で扱うため
 */
package com.example.auth.model;

public record ProviderIdentity(AuthProvider provider, String thirdPartyId) {
}
