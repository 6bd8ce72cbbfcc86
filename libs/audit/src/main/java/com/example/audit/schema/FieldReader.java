/*
 * どこで: 監査スキーマ登録
 * 何を: レコード型のフィールド定義の解決と値の読み出しを行う
 * なぜ: record と通常クラスの両方を同じ手順で監査できるようにするため
 */
package com.example.audit.schema;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Resolves named properties of a record type: record components first, then declared instance
 * fields along the superclass chain.
 */
public final class FieldReader {

  private static final ConcurrentMap<Class<?>, Map<String, Accessor>> ACCESSORS =
      new ConcurrentHashMap<>();

  private FieldReader() {}

  public static Optional<TrackedField> describe(Class<?> type, String name) {
    return Optional.ofNullable(accessors(type).get(name)).map(Accessor::field);
  }

  public static boolean hasField(Class<?> type, String name) {
    return accessors(type).containsKey(name);
  }

  public static Object read(Object instance, String name) {
    final Accessor accessor = accessors(instance.getClass()).get(name);
    if (accessor == null) {
      throw new ConfigurationException(
          "field " + name + " does not exist on " + instance.getClass().getName());
    }
    return accessor.read(instance);
  }

  private static Map<String, Accessor> accessors(Class<?> type) {
    return ACCESSORS.computeIfAbsent(type, FieldReader::scan);
  }

  private static Map<String, Accessor> scan(Class<?> type) {
    final Map<String, Accessor> found = new HashMap<>();
    if (type.isRecord()) {
      for (RecordComponent component : type.getRecordComponents()) {
        final Method accessor = component.getAccessor();
        accessor.trySetAccessible();
        found.put(
            component.getName(),
            new Accessor(
                new TrackedField(
                    component.getName(), component.getType(), component.getGenericType()),
                accessor,
                null));
      }
      return Map.copyOf(found);
    }
    // サブクラス側の宣言を優先する
    for (Class<?> current = type; current != null && current != Object.class;
        current = current.getSuperclass()) {
      for (Field field : current.getDeclaredFields()) {
        if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
          continue;
        }
        if (found.containsKey(field.getName())) {
          continue;
        }
        field.trySetAccessible();
        found.put(
            field.getName(),
            new Accessor(
                new TrackedField(field.getName(), field.getType(), field.getGenericType()),
                null,
                field));
      }
    }
    return Map.copyOf(found);
  }

  private record Accessor(TrackedField field, Method method, Field member) {

    Object read(Object instance) {
      try {
        return method != null ? method.invoke(instance) : member.get(instance);
      } catch (IllegalAccessException ex) {
        throw new ConfigurationException(
            "field " + field.name() + " is not readable on " + instance.getClass().getName(), ex);
      } catch (InvocationTargetException ex) {
        throw new ConfigurationException(
            "accessor for " + field.name() + " failed on " + instance.getClass().getName(),
            ex.getCause());
      }
    }
  }
}
