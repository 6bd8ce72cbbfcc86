/*
 * どこで: 監査エンジンの運用計測
 * 何を: 監査行の書き込み件数/失敗/所要時間と復元失敗を記録する
 * なぜ: 監査の取りこぼしや性能劣化を運用で検知できるようにするため
 */
package com.example.audit.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class AuditMetrics {

  private static final String METRIC_CHANGES_WRITTEN = "audit.changes.written";
  private static final String METRIC_COMMIT_FAILURES = "audit.commit.failures";
  private static final String METRIC_RESTORE_FAILURES = "audit.retrieval.restore.failures";
  private static final String METRIC_COMMIT = "audit.commit";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> writtenCounters = new ConcurrentHashMap<>();
  private final Counter commitFailures;
  private final Counter restoreFailures;
  private final Timer commitTimer;

  public AuditMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.commitFailures =
        Counter.builder(METRIC_COMMIT_FAILURES)
            .description("Audit batches that failed before commit")
            .register(meterRegistry);
    this.restoreFailures =
        Counter.builder(METRIC_RESTORE_FAILURES)
            .description("Audit entries whose stored values could not be restored")
            .register(meterRegistry);
    this.commitTimer =
        Timer.builder(METRIC_COMMIT)
            .description("Time spent diffing and writing audit rows at commit")
            .register(meterRegistry);
  }

  public void recordWritten(String table, int count) {
    if (count <= 0) {
      return;
    }
    writtenCounters
        .computeIfAbsent(
            table,
            ignored ->
                Counter.builder(METRIC_CHANGES_WRITTEN)
                    .description("Audit change rows written")
                    .tags(Tags.of("table", table))
                    .register(meterRegistry))
        .increment(count);
  }

  public void recordCommitFailure() {
    commitFailures.increment();
  }

  public void recordRestoreFailure() {
    restoreFailures.increment();
  }

  public void recordCommitDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    commitTimer.record(duration);
  }
}
