/*
 * どこで: 監査値シリアライザ
 * 何を: 値型ごとのハンドラを保持し、保存形式との相互変換を行う
 * なぜ: 組み込み型とユーザー登録型を同じ経路で扱うため
 */
package com.example.audit.serializer;

import com.example.audit.AuditException;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide registry of {@link TypeHandler}s keyed by exact value type.
 *
 * <p>User registrations take precedence over built-ins and never match subtypes. The only
 * non-exact matching is for the built-in sequence and mapping handlers, which accept any {@link
 * List} or {@link Map} implementation. Primitive types resolve through their wrapper.
 *
 * <p>Registration is expected during start-up; lookups are safe from any thread.
 */
public class TypeRegistry {

  private static final Logger logger = LoggerFactory.getLogger(TypeRegistry.class);

  private static final Map<Class<?>, Class<?>> PRIMITIVE_WRAPPERS =
      Map.of(
          boolean.class, Boolean.class,
          byte.class, Byte.class,
          char.class, Character.class,
          short.class, Short.class,
          int.class, Integer.class,
          long.class, Long.class,
          float.class, Float.class,
          double.class, Double.class);

  private final Map<Class<?>, TypeHandler<?>> builtins = TypeHandlers.builtins();
  private final ConcurrentMap<Class<?>, TypeHandler<?>> registered = new ConcurrentHashMap<>();

  public <T> void register(Class<T> type, TypeHandler<T> handler) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(handler, "handler");
    final Class<?> key = wrap(type);
    final TypeHandler<?> previous = registered.put(key, handler);
    if (previous != null || builtins.containsKey(key)) {
      logger.info("type handler overridden type={}", key.getName());
    } else {
      logger.debug("type handler registered type={}", key.getName());
    }
  }

  public boolean supports(Class<?> type) {
    return type != null && resolve(type).isPresent();
  }

  public boolean isSerializable(Object value) {
    return value == null || supports(value.getClass());
  }

  /** Serializes by the value's runtime type; {@code null} maps to an absent stored value. */
  public String serialize(Object value) {
    if (value == null) {
      return null;
    }
    return serialize(value, value.getClass());
  }

  /**
   * Serializes through the handler of {@code declaredType}, which is how tracked fields are
   * written so that any {@code List}/{@code Map} implementation resolves the same way.
   */
  public String serialize(Object value, Class<?> declaredType) {
    return serialize(value, (Type) declaredType);
  }

  /**
   * Serializes against a possibly parameterized declared type. A structured value is rejected
   * unless reading its JSON back through {@code declaredType} yields an equal value.
   */
  public String serialize(Object value, Type declaredType) {
    if (value == null) {
      return null;
    }
    final Class<?> rawType = rawType(declaredType);
    final TypeHandler<Object> handler =
        resolve(rawType)
            .orElseThrow(
                () ->
                    new UnsupportedTypeException(
                        "no type handler for " + declaredType.getTypeName()));
    if (!wrap(rawType).isInstance(value)) {
      throw new UnsupportedTypeException(
          "value of type "
              + value.getClass().getName()
              + " does not match declared type "
              + declaredType.getTypeName());
    }
    final String stored;
    try {
      stored = handler.serialize(value);
    } catch (AuditException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new UnsupportedTypeException(
          "type handler failed to serialize " + declaredType.getTypeName(), ex);
    }
    if (stored == null) {
      throw new UnsupportedTypeException(
          "type handler for " + declaredType.getTypeName() + " returned null");
    }
    if (TypeHandlers.isStructured(handler)) {
      verifyRestorable(value, stored, declaredType);
    }
    return stored;
  }

  /** Restores a stored value; {@code null} stays {@code null}. */
  @SuppressWarnings("unchecked")
  public <T> T deserialize(String stored, Class<T> type) {
    if (stored == null) {
      return null;
    }
    final TypeHandler<Object> handler =
        resolve(type)
            .orElseThrow(
                () -> new UnsupportedTypeException("no type handler for " + type.getName()));
    try {
      return (T) handler.deserialize(stored);
    } catch (DeserializationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new DeserializationException(
          "stored value cannot be restored as " + type.getName(), ex);
    }
  }

  /**
   * Restores a stored value as a possibly parameterized declared type, so that structured values
   * get their element and key types from the declaration.
   */
  public Object deserialize(String stored, Type declaredType) {
    if (stored == null) {
      return null;
    }
    final Class<?> rawType = rawType(declaredType);
    final TypeHandler<Object> handler =
        resolve(rawType)
            .orElseThrow(
                () ->
                    new UnsupportedTypeException(
                        "no type handler for " + declaredType.getTypeName()));
    if (!TypeHandlers.isStructured(handler)) {
      return deserialize(stored, rawType);
    }
    try {
      return TypeHandlers.readStructured(stored, declaredType);
    } catch (DeserializationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new DeserializationException(
          "stored value cannot be restored as " + declaredType.getTypeName(), ex);
    }
  }

  private static void verifyRestorable(Object value, String stored, Type declaredType) {
    final Object restored;
    try {
      restored = TypeHandlers.readStructured(stored, declaredType);
    } catch (RuntimeException ex) {
      throw new UnsupportedTypeException(
          "structured value cannot be read back as " + declaredType.getTypeName(), ex);
    }
    // JSON では Long/Integer の区別や Map キーの型が失われるため、復元結果で等価性を確かめる
    if (!value.equals(restored)) {
      throw new UnsupportedTypeException(
          "structured value does not restore equal as "
              + declaredType.getTypeName()
              + ": "
              + stored);
    }
  }

  @SuppressWarnings("unchecked")
  private Optional<TypeHandler<Object>> resolve(Class<?> type) {
    final Class<?> key = wrap(type);
    TypeHandler<?> handler = registered.get(key);
    if (handler == null) {
      handler = builtins.get(key);
    }
    if (handler == null && List.class.isAssignableFrom(key)) {
      handler = builtins.get(List.class);
    }
    if (handler == null && Map.class.isAssignableFrom(key)) {
      handler = builtins.get(Map.class);
    }
    return Optional.ofNullable((TypeHandler<Object>) handler);
  }

  private static Class<?> rawType(Type type) {
    if (type instanceof Class) {
      return (Class<?>) type;
    }
    if (type instanceof ParameterizedType) {
      return (Class<?>) ((ParameterizedType) type).getRawType();
    }
    // 型変数は上限境界の型で扱う
    if (type instanceof TypeVariable) {
      return rawType(((TypeVariable<?>) type).getBounds()[0]);
    }
    throw new UnsupportedTypeException("no type handler for " + type.getTypeName());
  }

  private static Class<?> wrap(Class<?> type) {
    return type.isPrimitive() ? PRIMITIVE_WRAPPERS.get(type) : type;
  }
}
