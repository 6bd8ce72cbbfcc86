/*
 * どこで: 監査スキーマ登録
 * 何を: ホストが起動時に監査対象を宣言するための拡張点を定義する
 * なぜ: 宣言の誤りをアプリ起動時点で検出するため
 */
package com.example.audit.schema;

@FunctionalInterface
public interface TrackedSchemaDeclarer {

  void declare(TrackedSchemaRegistry registry);
}
