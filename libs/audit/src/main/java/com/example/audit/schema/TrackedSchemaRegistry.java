/*
 * どこで: 監査スキーマ登録
 * 何を: レコード型ごとの監査宣言を検証して保持する
 * なぜ: 差分検出と照会が検証済みの宣言だけを参照するため
 */
package com.example.audit.schema;

import com.example.audit.serializer.TypeRegistry;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds one validated {@link TrackedSchema} per record type.
 *
 * <p>Declarations are expected at start-up and are validated eagerly: unknown fields, fields
 * without a type handler, relation collections and conflicting re-declarations raise {@link
 * ConfigurationException}. Re-declaring an identical schema returns the existing one.
 */
public class TrackedSchemaRegistry {

  private static final Logger logger = LoggerFactory.getLogger(TrackedSchemaRegistry.class);

  private static final Set<Class<?>> JSON_ELEMENT_TYPES =
      Set.of(
          String.class,
          Boolean.class,
          Object.class,
          Integer.class,
          Long.class,
          Short.class,
          BigInteger.class,
          Double.class,
          Float.class,
          BigDecimal.class);

  private static final Set<Class<?>> JSON_KEY_TYPES =
      Set.of(
          String.class,
          Object.class,
          Integer.class,
          Long.class,
          Short.class,
          BigInteger.class);

  private static final Set<Class<?>> RESOURCE_ID_TYPES =
      Set.of(
          String.class,
          Integer.class,
          int.class,
          Long.class,
          long.class,
          Short.class,
          short.class,
          BigInteger.class,
          UUID.class);

  private final TypeRegistry typeRegistry;
  private final String defaultUserIdField;
  private final ConcurrentMap<Class<?>, TrackedSchema> schemas = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Class<?>> tableOwners = new ConcurrentHashMap<>();

  public TrackedSchemaRegistry(TypeRegistry typeRegistry, String defaultUserIdField) {
    this.typeRegistry = typeRegistry;
    this.defaultUserIdField = defaultUserIdField;
  }

  public TrackedSchema declare(
      Class<?> recordType,
      Collection<String> trackedFields,
      String resourceIdField,
      String userIdField,
      String label) {
    return declare(
        TrackedSchemaDeclaration.of(recordType)
            .fields(trackedFields)
            .resourceIdField(resourceIdField)
            .userIdField(userIdField)
            .label(label));
  }

  public synchronized TrackedSchema declare(TrackedSchemaDeclaration declaration) {
    final TrackedSchema schema = build(declaration);
    final TrackedSchema existing = schemas.get(schema.recordType());
    if (existing != null) {
      if (existing.equals(schema)) {
        return existing;
      }
      throw new ConfigurationException(
          "record type already declared with a different schema: "
              + schema.recordType().getName());
    }
    final Class<?> owner = tableOwners.get(schema.tableName());
    if (owner != null) {
      throw new ConfigurationException(
          "table name " + schema.tableName() + " is already used by " + owner.getName());
    }
    tableOwners.put(schema.tableName(), schema.recordType());
    schemas.put(schema.recordType(), schema);
    logger.info(
        "audit schema declared table={} fields={} resourceIdField={}",
        schema.tableName(),
        schema.fieldNames(),
        schema.resourceIdField());
    return schema;
  }

  public Optional<TrackedSchema> lookup(Class<?> recordType) {
    return Optional.ofNullable(schemas.get(recordType));
  }

  public TrackedSchema require(Class<?> recordType) {
    return lookup(recordType).orElseThrow(() -> new TableNotRegisteredException(recordType));
  }

  public boolean isTracked(Class<?> recordType) {
    return schemas.containsKey(recordType);
  }

  public Collection<TrackedSchema> schemas() {
    return List.copyOf(schemas.values());
  }

  private TrackedSchema build(TrackedSchemaDeclaration declaration) {
    final Class<?> recordType = declaration.recordType();
    final String typeName = recordType.getName();
    final List<String> names = declaration.trackedFields();
    if (names.isEmpty()) {
      throw new ConfigurationException("tracked fields must not be empty: " + typeName);
    }
    if (new LinkedHashSet<>(names).size() != names.size()) {
      throw new ConfigurationException("tracked fields contain duplicates: " + typeName);
    }

    final List<TrackedField> fields = new ArrayList<>(names.size());
    for (String name : names) {
      final TrackedField field =
          FieldReader.describe(recordType, name)
              .orElseThrow(
                  () ->
                      new ConfigurationException(
                          "tracked field " + name + " does not exist on " + typeName));
      validateFieldType(recordType, field);
      fields.add(field);
    }

    final String resourceIdField = resolveResourceIdField(declaration);
    final String userIdField = resolveUserIdField(declaration);
    final String simpleName = recordType.getSimpleName();
    final String tableName = nonBlankOr(declaration.tableName(), simpleName);
    final String label = nonBlankOr(declaration.label(), simpleName);
    return new TrackedSchema(recordType, tableName, fields, resourceIdField, userIdField, label);
  }

  private void validateFieldType(Class<?> recordType, TrackedField field) {
    if (!typeRegistry.supports(field.type())) {
      throw new ConfigurationException(
          "tracked field "
              + field.name()
              + " on "
              + recordType.getName()
              + " has no type handler for "
              + field.type().getName());
    }
    final boolean structured =
        List.class.isAssignableFrom(field.type()) || Map.class.isAssignableFrom(field.type());
    if (structured && !isJsonShaped(field.genericType())) {
      throw new ConfigurationException(
          "tracked field "
              + field.name()
              + " on "
              + recordType.getName()
              + " is a relation collection or holds values json cannot restore");
    }
  }

  private String resolveResourceIdField(TrackedSchemaDeclaration declaration) {
    final Class<?> recordType = declaration.recordType();
    String name = declaration.resourceIdField();
    if (name == null || name.isBlank()) {
      name = defaultResourceIdField(recordType);
      logger.warn(
          "resource id field not specified, defaulting type={} field={}",
          recordType.getSimpleName(),
          name);
    }
    final String resolved = name;
    final TrackedField field =
        FieldReader.describe(recordType, resolved)
            .orElseThrow(
                () ->
                    new ConfigurationException(
                        "resource id field "
                            + resolved
                            + " does not exist on "
                            + recordType.getName()));
    if (!RESOURCE_ID_TYPES.contains(field.type())) {
      throw new ConfigurationException(
          "resource id field "
              + resolved
              + " must be a string, integral number or uuid: "
              + field.type().getName());
    }
    return resolved;
  }

  private String defaultResourceIdField(Class<?> recordType) {
    if (FieldReader.hasField(recordType, "id")) {
      return "id";
    }
    final String simpleName = recordType.getSimpleName();
    final String conventional =
        Character.toLowerCase(simpleName.charAt(0)) + simpleName.substring(1) + "Id";
    if (FieldReader.hasField(recordType, conventional)) {
      return conventional;
    }
    throw new ConfigurationException(
        "resource id field cannot be inferred for "
            + recordType.getName()
            + ", declare it explicitly");
  }

  private String resolveUserIdField(TrackedSchemaDeclaration declaration) {
    final Class<?> recordType = declaration.recordType();
    final String explicit = declaration.userIdField();
    if (explicit != null && !explicit.isBlank()) {
      if (!FieldReader.hasField(recordType, explicit)) {
        throw new ConfigurationException(
            "user id field " + explicit + " does not exist on " + recordType.getName());
      }
      return explicit;
    }
    if (defaultUserIdField != null
        && !defaultUserIdField.isBlank()
        && FieldReader.hasField(recordType, defaultUserIdField)) {
      return defaultUserIdField;
    }
    return null;
  }

  // List/Map の要素が JSON から同じ型で読み戻せる値か。エンティティの集合は関連として扱い拒否する
  private static boolean isJsonShaped(Type type) {
    if (type instanceof Class<?> raw) {
      return JSON_ELEMENT_TYPES.contains(raw)
          || List.class.isAssignableFrom(raw)
          || Map.class.isAssignableFrom(raw);
    }
    if (type instanceof ParameterizedType parameterized) {
      if (!(parameterized.getRawType() instanceof Class<?> raw)
          || !(List.class.isAssignableFrom(raw) || Map.class.isAssignableFrom(raw))) {
        return false;
      }
      final Type[] arguments = parameterized.getActualTypeArguments();
      for (int i = 0; i < arguments.length; i++) {
        final boolean mapKey = i == 0 && Map.class.isAssignableFrom(raw);
        if (mapKey ? !isJsonKey(arguments[i]) : !isJsonShaped(arguments[i])) {
          return false;
        }
      }
      return true;
    }
    if (type instanceof WildcardType wildcard) {
      for (Type bound : wildcard.getUpperBounds()) {
        if (!isJsonShaped(bound)) {
          return false;
        }
      }
      return true;
    }
    return false;
  }

  // JSON のキーは文字列になるため、文字列から復元できる型だけを Map のキーに許す
  private static boolean isJsonKey(Type type) {
    if (type instanceof WildcardType wildcard) {
      for (Type bound : wildcard.getUpperBounds()) {
        if (!isJsonKey(bound)) {
          return false;
        }
      }
      return true;
    }
    return type instanceof Class<?> raw && JSON_KEY_TYPES.contains(raw);
  }

  private static String nonBlankOr(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }
}
