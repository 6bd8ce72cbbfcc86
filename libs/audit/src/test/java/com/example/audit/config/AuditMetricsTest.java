/*
 * どこで: 監査メトリクスのテスト
 * 何を: 書き込み件数/失敗/所要時間/復元失敗が記録されることを検証する
 * なぜ: 監査の運用指標の計測回帰を防ぐため
 */
package com.example.audit.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class AuditMetricsTest {

  @Test
  void recordsWriteAndFailureMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final AuditMetrics metrics = new AuditMetrics(registry);

    metrics.recordWritten("Customer", 3);
    metrics.recordWritten("Customer", 0);
    metrics.recordWritten("Order", 1);
    metrics.recordCommitFailure();
    metrics.recordRestoreFailure();
    metrics.recordCommitDuration(Duration.ofMillis(5));
    metrics.recordCommitDuration(Duration.ofMillis(-1));

    assertThat(registry.get("audit.changes.written").tag("table", "Customer").counter().count())
        .isEqualTo(3.0d);
    assertThat(registry.get("audit.changes.written").tag("table", "Order").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("audit.commit.failures").counter().count()).isEqualTo(1.0d);
    assertThat(registry.get("audit.retrieval.restore.failures").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("audit.commit").timer().count()).isEqualTo(1L);
  }
}
