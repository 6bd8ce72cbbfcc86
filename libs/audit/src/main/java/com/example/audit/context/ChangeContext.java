/*
 * どこで: 監査コンテキスト
 * 何を: 1 つの作業単位に属するフレームのスタックを管理する
 * なぜ: 入れ子のスコープごとに監査情報を切り替えるため
 */
package com.example.audit.context;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Stack of {@link AuditFrame}s for one unit of work. The top frame is the effective one; frames do
 * not inherit values from frames below them. Instances are confined to one thread.
 */
public class ChangeContext {

  private final Deque<AuditFrame> frames = new ArrayDeque<>();
  private final IdentityResolver identityResolver;

  public ChangeContext() {
    this(IdentityResolver.NONE);
  }

  public ChangeContext(IdentityResolver identityResolver) {
    this.identityResolver = Objects.requireNonNull(identityResolver, "identityResolver");
  }

  public void push(AuditFrame frame) {
    frames.push(Objects.requireNonNull(frame, "frame"));
  }

  public AuditFrame pop() {
    if (frames.isEmpty()) {
      throw new ContextStackException("context stack is empty");
    }
    return frames.pop();
  }

  /** Pushes {@code frame} and returns a scope that pops exactly that frame when closed. */
  public Scope open(AuditFrame frame) {
    push(frame);
    return new Scope(frame, frames.size());
  }

  /**
   * Returns the top frame's values. When the frame has no acting user, the identity resolver is
   * consulted; an empty stack yields the resolver's user and nothing else.
   */
  public EffectiveContext current() {
    final AuditFrame top = frames.peek();
    final String framedUser = top == null ? null : top.actingUserId();
    final String actingUser = framedUser != null ? framedUser : resolveIdentity();
    if (top == null) {
      return actingUser == null
          ? EffectiveContext.EMPTY
          : new EffectiveContext(actingUser, null, null);
    }
    return new EffectiveContext(actingUser, top.reason(), top.impersonatedBy());
  }

  public int depth() {
    return frames.size();
  }

  private String resolveIdentity() {
    final String resolved = identityResolver.currentUserId();
    return resolved == null || resolved.isBlank() ? null : resolved;
  }

  public final class Scope implements AutoCloseable {

    private final AuditFrame frame;
    private final int depthAtOpen;
    private boolean closed;

    private Scope(AuditFrame frame, int depthAtOpen) {
      this.frame = frame;
      this.depthAtOpen = depthAtOpen;
    }

    public AuditFrame frame() {
      return frame;
    }

    @Override
    public void close() {
      if (closed) {
        return;
      }
      if (frames.size() != depthAtOpen || frames.peek() != frame) {
        throw new ContextStackException(
            "scope closed out of order: expected depth "
                + depthAtOpen
                + " but was "
                + frames.size());
      }
      frames.pop();
      closed = true;
    }
  }
}
