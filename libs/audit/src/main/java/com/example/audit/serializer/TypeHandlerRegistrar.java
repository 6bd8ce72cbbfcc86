/*
 * どこで: 監査値シリアライザ
 * 何を: ホストがカスタム型ハンドラを登録するための拡張点を定義する
 * なぜ: スキーマ宣言より前に独自型を使えるようにするため
 */
package com.example.audit.serializer;

@FunctionalInterface
public interface TypeHandlerRegistrar {

  void registerHandlers(TypeRegistry registry);
}
