/*
 * どこで: Auth アプリの設定バインド
 * 何を: signup プロパティ未設定時の既定値を保持する
 * なぜ: properties テーブルが空の環境でも signup 可否を決められるようにするため
 */
package com.example.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "auth.signup")
public record AuthSignupProperties(Boolean defaultEnabled) {

  public AuthSignupProperties {
    defaultEnabled = defaultEnabled == null ? Boolean.TRUE : defaultEnabled;
  }
}
