/*
 * どこで: 監査値シリアライザ
 * 何を: 1 つの値型と保存形式(文字列)の相互変換を定義する
 * なぜ: 任意の型を汎用カラムに可逆で保存するため
 */
package com.example.audit.serializer;

import java.util.Objects;
import java.util.function.Function;

/**
 * Converts values of one exact type to their stored text form and back.
 *
 * <p>Implementations must satisfy {@code deserialize(serialize(v)).equals(v)} for every non-null
 * value they accept. {@code null} never reaches a handler; the registry maps it to an absent stored
 * value.
 */
public interface TypeHandler<T> {

  String serialize(T value);

  /**
   * @throws DeserializationException when {@code stored} is not a valid encoding
   */
  T deserialize(String stored);

  static <T> TypeHandler<T> of(Function<T, String> serializer, Function<String, T> deserializer) {
    Objects.requireNonNull(serializer, "serializer");
    Objects.requireNonNull(deserializer, "deserializer");
    return new TypeHandler<>() {
      @Override
      public String serialize(T value) {
        return serializer.apply(value);
      }

      @Override
      public T deserialize(String stored) {
        return deserializer.apply(stored);
      }
    };
  }
}
