/*
 * どこで: Healthion サービス層
 * 何を: upstream 登録結果と upstream 連携エラーのメトリクスを記録する
 * なぜ: 登録競合の頻度と UPSTREAM_* エラー増加を Prometheus から観測できるようにするため
 */
package com.healthion.bff.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class HealthionMetrics {

  static final String METRIC_REGISTRATION_TOTAL = "healthion.registration.total";
  static final String METRIC_UPSTREAM_ERROR_TOTAL = "healthion.upstream.error.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> registrationCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> upstreamErrorCounters = new ConcurrentHashMap<>();

  public HealthionMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordRegistration(String outcome) {
    registrationCounters
        .computeIfAbsent(
            outcome,
            ignored ->
                Counter.builder(METRIC_REGISTRATION_TOTAL)
                    .description("Upstream registration outcomes")
                    .tags(Tags.of("outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void recordUpstreamError(String code) {
    upstreamErrorCounters
        .computeIfAbsent(
            code,
            ignored ->
                Counter.builder(METRIC_UPSTREAM_ERROR_TOTAL)
                    .description("Wearables platform integration errors by code")
                    .tags(Tags.of("code", code))
                    .register(meterRegistry))
        .increment();
  }
}
