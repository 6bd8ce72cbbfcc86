/*
 * どこで: 監査エンジンのテスト基盤
 * 何を: 監査対象として宣言するテスト用レコード型
 * なぜ: 文字列/浮動小数/List/真偽値の各経路を 1 つの型で通すため
 */
package com.example.audit.support;

import java.util.List;

public record Widget(
    String widgetId, String name, Double price, List<Object> tags, Boolean active, String ownerId) {

  public Widget withName(String newName) {
    return new Widget(widgetId, newName, price, tags, active, ownerId);
  }

  public Widget withPrice(Double newPrice) {
    return new Widget(widgetId, name, newPrice, tags, active, ownerId);
  }

  public Widget withTags(List<Object> newTags) {
    return new Widget(widgetId, name, price, newTags, active, ownerId);
  }
}
