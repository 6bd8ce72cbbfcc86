/*
 * どこで: 監査履歴の照会
 * 何を: 照会結果の時系列の並び順を定義する
 * なぜ: 古い順/新しい順の両方で履歴を表示できるようにするため
 */
package com.example.audit.retrieval;

public enum SortDirection {
  ASC,
  DESC
}
