/*
 * どこで: Auth サービス層
 * 何を: ログイン判定の結果とユーザー自動作成の件数をメトリクスに記録する
 * なぜ: 認証失敗率と signup 流入を Prometheus から直接観測できるようにするため
 */
package com.example.auth.service;

import com.example.auth.model.AuthProvider;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class LoginMetrics {

  private static final String METRIC_LOGIN_TOTAL = "auth.login.total";
  private static final String METRIC_USER_PROVISIONED_TOTAL = "auth.user.provisioned.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> loginCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<AuthProvider, Counter> provisionedCounters =
      new ConcurrentHashMap<>();

  public LoginMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordIssued(LoginMethod method) {
    recordLogin(method, "issued");
  }

  public void recordRejected(LoginMethod method, LoginFailure failure) {
    recordLogin(method, failure.name().toLowerCase(Locale.ROOT));
  }

  public void recordUserProvisioned(AuthProvider provider) {
    provisionedCounters
        .computeIfAbsent(
            provider,
            ignored ->
                Counter.builder(METRIC_USER_PROVISIONED_TOTAL)
                    .description("Users created at login time")
                    .tags(Tags.of("provider", provider.name()))
                    .register(meterRegistry))
        .increment();
  }

  private void recordLogin(LoginMethod method, String result) {
    final String key = method.tagValue() + ":" + result;
    loginCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_LOGIN_TOTAL)
                    .description("Login validation outcomes")
                    .tags(Tags.of("method", method.tagValue(), "result", result))
                    .register(meterRegistry))
        .increment();
  }
}
