/*
 * どこで: 監査差分検出/照会
 * 何を: リソース ID を保存用の文字列へ正規化する
 * なぜ: 書き込み時と照会時で同じキー表現を使うため
 */
package com.example.audit.diff;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

public final class ResourceIds {

  private static final Pattern UUID_TEXT =
      Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

  private ResourceIds() {}

  /**
   * Renders a resource id as text; empty when the value is absent, blank or of another type. Text
   * in canonical UUID form is lower-cased to match how {@link UUID} ids are rendered.
   */
  public static Optional<String> normalize(Object value) {
    if (value instanceof String text) {
      if (text.isBlank()) {
        return Optional.empty();
      }
      return Optional.of(
          UUID_TEXT.matcher(text).matches() ? text.toLowerCase(Locale.ROOT) : text);
    }
    if (value instanceof Integer
        || value instanceof Long
        || value instanceof Short
        || value instanceof BigInteger
        || value instanceof UUID) {
      return Optional.of(value.toString());
    }
    return Optional.empty();
  }
}
