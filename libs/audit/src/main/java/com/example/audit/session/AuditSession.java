/*
 * どこで: 監査トランザクション連携
 * 何を: 1 トランザクション中に登録されたインスタンスとその時点のコンテキストを保持する
 * なぜ: コミット直前にまとめて差分を計算するため
 */
package com.example.audit.session;

import com.example.audit.context.EffectiveContext;
import com.example.audit.diff.DirtyStateOracle;
import com.example.audit.diff.TrackedInstance;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Instances enlisted in one transaction, in enlist order. The same object enlisted twice is kept
 * once, with the context captured by its first enlistment.
 */
public class AuditSession {

  private final Map<Object, Boolean> seen = new IdentityHashMap<>();
  private final List<Enlisted> entries = new ArrayList<>();

  public boolean add(TrackedInstance tracked, EffectiveContext context, DirtyStateOracle oracle) {
    if (seen.put(tracked.instance(), Boolean.TRUE) != null) {
      return false;
    }
    entries.add(new Enlisted(tracked, context, oracle));
    return true;
  }

  public List<Enlisted> entries() {
    return Collections.unmodifiableList(entries);
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int size() {
    return entries.size();
  }

  public void clear() {
    seen.clear();
    entries.clear();
  }

  public record Enlisted(
      TrackedInstance tracked, EffectiveContext context, DirtyStateOracle oracle) {}
}
