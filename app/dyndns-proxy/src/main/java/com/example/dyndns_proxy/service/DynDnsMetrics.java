/*
 * どこで: DynDNS プロキシのサービス層
 * 何を: 更新結果とプロバイダ呼び出し時間のメトリクスを記録する
 * なぜ: 911 応答の増加や Cloudflare の遅延を Prometheus から観測できるようにするため
 */
package com.example.dyndns_proxy.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class DynDnsMetrics {

  private static final String METRIC_UPDATE_TOTAL = "dyndns.update.total";
  private static final String METRIC_PROVIDER_CALL_DURATION = "dyndns.provider.call.duration";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> updateCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> providerCallTimers = new ConcurrentHashMap<>();

  public DynDnsMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordUpdateResult(String result) {
    updateCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_UPDATE_TOTAL)
                    .description("DynDNS update outcomes by response token")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public Timer.Sample startProviderCall() {
    return Timer.start(meterRegistry);
  }

  public void recordProviderCall(Timer.Sample sample, String operation, String result) {
    final String key = operation + "|" + result;
    final Timer timer =
        providerCallTimers.computeIfAbsent(
            key,
            ignored ->
                Timer.builder(METRIC_PROVIDER_CALL_DURATION)
                    .description("DNS provider call duration")
                    .tags(Tags.of("operation", operation, "result", result))
                    .register(meterRegistry));
    sample.stop(timer);
  }
}
