/*
 * どこで: 監査コンテキスト
 * 何を: 操作者/理由/なりすまし元をまとめた 1 フレームを表す
 * なぜ: 変更の背景情報を監査ログに残すため
 */
package com.example.audit.context;

/**
 * One frame of audit context. Every value is optional; a present value must be non-blank and fit
 * the column it is stored in.
 */
public record AuditFrame(String actingUserId, String reason, String impersonatedBy) {

  public static final int MAX_USER_ID_LENGTH = 256;
  public static final int MAX_REASON_LENGTH = 512;

  public AuditFrame {
    validate("actingUserId", actingUserId, MAX_USER_ID_LENGTH);
    validate("reason", reason, MAX_REASON_LENGTH);
    validate("impersonatedBy", impersonatedBy, MAX_USER_ID_LENGTH);
  }

  public static AuditFrame empty() {
    return new AuditFrame(null, null, null);
  }

  public static AuditFrame actingUser(String actingUserId) {
    return new AuditFrame(actingUserId, null, null);
  }

  public AuditFrame withReason(String reason) {
    return new AuditFrame(actingUserId, reason, impersonatedBy);
  }

  public AuditFrame withImpersonatedBy(String impersonatedBy) {
    return new AuditFrame(actingUserId, reason, impersonatedBy);
  }

  private static void validate(String name, String value, int maxLength) {
    if (value == null) {
      return;
    }
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    if (value.length() > maxLength) {
      throw new IllegalArgumentException(name + " must be at most " + maxLength + " characters");
    }
  }
}
