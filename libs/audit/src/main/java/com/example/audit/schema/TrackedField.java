/*
 * どこで: 監査スキーマ登録
 * 何を: 監査対象フィールド 1 件の名前と宣言型を保持する
 * なぜ: 書き込み/復元の双方で同じ型情報を使うため
 */
package com.example.audit.schema;

import java.lang.reflect.Type;

public record TrackedField(String name, Class<?> type, Type genericType) {}
