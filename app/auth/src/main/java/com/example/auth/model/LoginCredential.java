/*
 * どこで: app/auth/src/main/java/com/example/auth/model/LoginCredential.java
 * 何を: ログインに使う資格情報 3 種のタグ付き共用体
 * なぜ: 入口ごとに検索キーと作成可否が異なるため、種類を型で区別する
 */
package com.example.auth.model;

public sealed interface LoginCredential
    permits LoginCredential.Anonymous,
        LoginCredential.FederatedIdentity,
        LoginCredential.OAuth {

  record Anonymous(String rawToken) implements LoginCredential {

    @Override
    public String toString() {
      return "Anonymous[rawToken=***]";
    }
  }

  record FederatedIdentity(String principalId) implements LoginCredential {}

  record OAuth(AuthProvider provider, String thirdPartyId) implements LoginCredential {

    public ProviderIdentity identity() {
      return new ProviderIdentity(provider, thirdPartyId);
    }
  }
}
