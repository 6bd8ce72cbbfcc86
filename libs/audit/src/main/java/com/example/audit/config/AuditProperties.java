/*
 * どこで: 監査エンジンの設定バインド
 * 何を: 監査の有効/無効と既定の利用者 ID フィールド名を保持する
 * なぜ: 環境ごとに監査の動作を切り替えられるようにするため
 */
package com.example.audit.config;

import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "audit")
public record AuditProperties(
    @DefaultValue("true") boolean enabled,
    @Pattern(regexp = "[A-Za-z_$][A-Za-z0-9_$]*") String defaultUserIdField) {}
