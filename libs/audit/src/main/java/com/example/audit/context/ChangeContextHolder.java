/*
 * どこで: 監査コンテキスト
 * 何を: スレッドごとに独立した ChangeContext を払い出す
 * なぜ: 並行リクエスト間で監査情報が混ざらないようにするため
 */
package com.example.audit.context;

import java.util.Objects;
import java.util.function.Supplier;

public class ChangeContextHolder {

  private final IdentityResolver identityResolver;
  private final ThreadLocal<ChangeContext> contexts;

  public ChangeContextHolder(IdentityResolver identityResolver) {
    this.identityResolver = Objects.requireNonNull(identityResolver, "identityResolver");
    this.contexts = ThreadLocal.withInitial(() -> new ChangeContext(this.identityResolver));
  }

  /** Returns the calling thread's context. */
  public ChangeContext current() {
    return contexts.get();
  }

  public void runWith(AuditFrame frame, Runnable action) {
    final ChangeContext context = current();
    try (ChangeContext.Scope ignored = context.open(frame)) {
      action.run();
    } finally {
      releaseIfEmpty(context);
    }
  }

  public <T> T callWith(AuditFrame frame, Supplier<T> action) {
    final ChangeContext context = current();
    try (ChangeContext.Scope ignored = context.open(frame)) {
      return action.get();
    } finally {
      releaseIfEmpty(context);
    }
  }

  // プールされたスレッドに空のスタックを残さない
  private void releaseIfEmpty(ChangeContext context) {
    if (context.depth() == 0) {
      contexts.remove();
    }
  }
}
