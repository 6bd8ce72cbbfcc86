/*
 * どこで: 監査差分検出
 * 何を: 差分対象のインスタンスと、その型の監査宣言を組にする
 * なぜ: 差分計算中にスキーマを引き直さないため
 */
package com.example.audit.diff;

import com.example.audit.schema.TrackedSchema;

public record TrackedInstance(Object instance, TrackedSchema schema) {}
