/*
 * どこで: 監査値シリアライザ
 * 何を: 組み込み型(数値/文字列/真偽値/日時/UUID/バイト列/List/Map)のハンドラを提供する
 * なぜ: 代表的なカラム型を登録なしで可逆に保存できるようにするため
 */
package com.example.audit.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

public final class TypeHandlers {

  private static final String TRUE_FORM = "1";
  private static final String FALSE_FORM = "0";

  // Map のキー順を固定し、等しい値が常に同じ保存形式になるようにする
  private static final ObjectMapper CANONICAL_JSON =
      JsonMapper.builder().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS).build();

  public static final TypeHandler<String> STRING = TypeHandler.of(value -> value, stored -> stored);
  public static final TypeHandler<Integer> INTEGER =
      TypeHandler.of(String::valueOf, Integer::valueOf);
  public static final TypeHandler<Long> LONG = TypeHandler.of(String::valueOf, Long::valueOf);
  public static final TypeHandler<Short> SHORT = TypeHandler.of(String::valueOf, Short::valueOf);
  public static final TypeHandler<BigInteger> BIG_INTEGER =
      TypeHandler.of(BigInteger::toString, BigInteger::new);
  // Double.toString は最短の往復可能表現を返すため、-0.0/NaN/Infinity もビット単位で戻る
  public static final TypeHandler<Double> DOUBLE =
      TypeHandler.of(value -> Double.toString(value), Double::valueOf);
  public static final TypeHandler<Float> FLOAT =
      TypeHandler.of(value -> Float.toString(value), Float::valueOf);
  // toPlainString ではなく toString を使い、scale を含めて復元する
  public static final TypeHandler<BigDecimal> BIG_DECIMAL =
      TypeHandler.of(BigDecimal::toString, BigDecimal::new);
  public static final TypeHandler<Boolean> BOOLEAN =
      TypeHandler.of(value -> value ? TRUE_FORM : FALSE_FORM, TypeHandlers::parseBoolean);
  public static final TypeHandler<Instant> INSTANT =
      TypeHandler.of(Instant::toString, Instant::parse);
  public static final TypeHandler<OffsetDateTime> OFFSET_DATE_TIME =
      TypeHandler.of(OffsetDateTime::toString, OffsetDateTime::parse);
  public static final TypeHandler<LocalDateTime> LOCAL_DATE_TIME =
      TypeHandler.of(LocalDateTime::toString, LocalDateTime::parse);
  public static final TypeHandler<LocalDate> LOCAL_DATE =
      TypeHandler.of(LocalDate::toString, LocalDate::parse);
  public static final TypeHandler<UUID> UUID_HANDLER =
      TypeHandler.of(UUID::toString, TypeHandlers::parseUuid);
  public static final TypeHandler<byte[]> BYTES =
      TypeHandler.of(
          value -> Base64.getEncoder().encodeToString(value),
          stored -> Base64.getDecoder().decode(stored));
  public static final TypeHandler<List<?>> LIST =
      TypeHandler.of(
          TypeHandlers::writeJson, stored -> (List<?>) readStructured(stored, List.class));
  public static final TypeHandler<Map<?, ?>> MAP =
      TypeHandler.of(
          TypeHandlers::writeJson, stored -> (Map<?, ?>) readStructured(stored, Map.class));

  private TypeHandlers() {}

  /** Builds a handler that stores an enum constant by {@link Enum#name()}. */
  public static <E extends Enum<E>> TypeHandler<E> forEnum(Class<E> enumType) {
    Objects.requireNonNull(enumType, "enumType");
    return TypeHandler.of(Enum::name, stored -> Enum.valueOf(enumType, stored));
  }

  static Map<Class<?>, TypeHandler<?>> builtins() {
    final Map<Class<?>, TypeHandler<?>> handlers = new LinkedHashMap<>();
    handlers.put(String.class, STRING);
    handlers.put(Integer.class, INTEGER);
    handlers.put(Long.class, LONG);
    handlers.put(Short.class, SHORT);
    handlers.put(BigInteger.class, BIG_INTEGER);
    handlers.put(Double.class, DOUBLE);
    handlers.put(Float.class, FLOAT);
    handlers.put(BigDecimal.class, BIG_DECIMAL);
    handlers.put(Boolean.class, BOOLEAN);
    handlers.put(Instant.class, INSTANT);
    handlers.put(OffsetDateTime.class, OFFSET_DATE_TIME);
    handlers.put(LocalDateTime.class, LOCAL_DATE_TIME);
    handlers.put(LocalDate.class, LOCAL_DATE);
    handlers.put(UUID.class, UUID_HANDLER);
    handlers.put(byte[].class, BYTES);
    handlers.put(List.class, LIST);
    handlers.put(Map.class, MAP);
    return Map.copyOf(handlers);
  }

  private static Boolean parseBoolean(String stored) {
    if (TRUE_FORM.equals(stored)) {
      return Boolean.TRUE;
    }
    if (FALSE_FORM.equals(stored)) {
      return Boolean.FALSE;
    }
    throw new DeserializationException("boolean stored form must be '1' or '0': " + stored);
  }

  private static UUID parseUuid(String stored) {
    final UUID parsed = UUID.fromString(stored);
    // UUID.fromString は桁の省略を許すため、正規形と一致しない入力は不正として扱う
    if (!parsed.toString().equalsIgnoreCase(stored)) {
      throw new DeserializationException("uuid stored form is not canonical: " + stored);
    }
    return parsed;
  }

  private static String writeJson(Object value) {
    try {
      return CANONICAL_JSON.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new UnsupportedTypeException(
          "structured value cannot be encoded as json: " + ex.getOriginalMessage(), ex);
    }
  }

  static boolean isStructured(TypeHandler<?> handler) {
    return handler == LIST || handler == MAP;
  }

  /**
   * Reads a JSON stored form back as {@code declaredType}. Element and key types come from the
   * type arguments; a bare class reads as a plain {@code List} or {@code Map}.
   */
  static Object readStructured(String stored, Type declaredType) {
    final JavaType type = CANONICAL_JSON.getTypeFactory().constructType(readType(declaredType));
    return readJson(stored, type);
  }

  // 実装クラス(不変リスト等)は Jackson が生成できないため、型引数のない宣言は List/Map として読む
  private static Type readType(Type declaredType) {
    if (declaredType instanceof Class) {
      return List.class.isAssignableFrom((Class<?>) declaredType) ? List.class : Map.class;
    }
    return declaredType;
  }

  private static Object readJson(String stored, JavaType type) {
    try {
      final Object parsed = CANONICAL_JSON.readValue(stored, type);
      if (parsed == null) {
        throw new DeserializationException("json stored form decoded to null");
      }
      return parsed;
    } catch (JsonProcessingException ex) {
      throw new DeserializationException(
          "json stored form is malformed: " + ex.getOriginalMessage(), ex);
    }
  }
}
