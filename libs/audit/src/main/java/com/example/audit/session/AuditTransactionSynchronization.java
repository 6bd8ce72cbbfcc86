/*
 * どこで: 監査トランザクション連携
 * 何を: コミット直前に差分を計算して監査行を書き込み、完了後にセッションを解放する
 * なぜ: 業務データと監査行を同じトランザクションで確定させるため
 */
package com.example.audit.session;

import com.example.audit.config.AuditMetrics;
import com.example.audit.context.EffectiveContext;
import com.example.audit.diff.DiffEngine;
import com.example.audit.diff.PendingChange;
import com.example.audit.writer.AuditWriter;
import com.example.common.JdbcTimestampUtils;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionSynchronization;

/**
 * Writes the audit rows of one transaction from {@link #beforeCommit}. Every change is computed
 * before anything is written, and all rows share one timestamp. A failure propagates so that the
 * surrounding transaction rolls back. Being a synchronization, the session is suspended and resumed
 * together with its transaction.
 */
class AuditTransactionSynchronization implements TransactionSynchronization {

  private static final Logger logger =
      LoggerFactory.getLogger(AuditTransactionSynchronization.class);

  private final Object owner;
  private final AuditSession session;
  private final DiffEngine diffEngine;
  private final AuditWriter writer;
  private final AuditMetrics metrics;
  private final Clock clock;

  AuditTransactionSynchronization(
      Object owner,
      AuditSession session,
      DiffEngine diffEngine,
      AuditWriter writer,
      AuditMetrics metrics,
      Clock clock) {
    this.owner = owner;
    this.session = session;
    this.diffEngine = diffEngine;
    this.writer = writer;
    this.metrics = metrics;
    this.clock = clock;
  }

  @Override
  public void beforeCommit(boolean readOnly) {
    if (session.isEmpty()) {
      return;
    }
    final long startedAt = System.nanoTime();
    try {
      final List<ContextRun> runs = computeAll();
      final Instant batchTimestamp = JdbcTimestampUtils.truncateToDbPrecision(clock.instant());
      int written = 0;
      for (ContextRun run : runs) {
        written += writer.commit(run.changes(), run.context(), batchTimestamp);
      }
      logger.debug(
          "audit batch committed instances={} rows={} changedAt={}",
          session.size(),
          written,
          batchTimestamp);
    } catch (RuntimeException ex) {
      metrics.recordCommitFailure();
      logger.warn("audit batch failed, transaction will roll back", ex);
      throw ex;
    } finally {
      metrics.recordCommitDuration(Duration.ofNanos(System.nanoTime() - startedAt));
    }
  }

  @Override
  public void afterCompletion(int status) {
    session.clear();
  }

  boolean ownedBy(Object candidate) {
    return owner == candidate;
  }

  AuditSession session() {
    return session;
  }

  // 書き込み前に全件の差分を確定させ、途中失敗で一部だけ書かれることを防ぐ
  // 連続する同一コンテキストだけをまとめ、change_id の採番が登録順に並ぶようにする
  private List<ContextRun> computeAll() {
    final List<ContextRun> runs = new ArrayList<>();
    for (AuditSession.Enlisted enlisted : session.entries()) {
      final List<PendingChange> changes =
          diffEngine.computeChanges(List.of(enlisted.tracked()), enlisted.oracle());
      if (changes.isEmpty()) {
        continue;
      }
      final ContextRun last = runs.isEmpty() ? null : runs.get(runs.size() - 1);
      if (last != null && last.context().equals(enlisted.context())) {
        last.changes().addAll(changes);
      } else {
        runs.add(new ContextRun(enlisted.context(), new ArrayList<>(changes)));
      }
    }
    return runs;
  }

  private record ContextRun(EffectiveContext context, List<PendingChange> changes) {}
}
