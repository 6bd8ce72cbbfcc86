/*
 * どこで: Customer アプリの監査設定
 * 何を: 監査対象の宣言と操作者の解決方法を登録する
 * なぜ: 監査エンジンに顧客レコードとリクエスト利用者を結び付けるため
 */
package com.example.customer.config;

import com.example.audit.config.AuditConfig;
import com.example.audit.context.IdentityResolver;
import com.example.audit.schema.TrackedSchemaDeclaration;
import com.example.audit.schema.TrackedSchemaDeclarer;
import com.example.customer.model.CustomerRecord;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@Configuration
@Import(AuditConfig.class)
public class CustomerAuditConfig {

  public static final String CUSTOMER_LABEL = "Customer";

  // tags は業務上の分類なので監査対象にしない
  @Bean
  public TrackedSchemaDeclarer customerSchemaDeclarer() {
    return registry ->
        registry.declare(
            TrackedSchemaDeclaration.of(CustomerRecord.class)
                .fields("name", "email")
                .tableName("customers")
                .resourceIdField("customerId")
                .label(CUSTOMER_LABEL));
  }

  // X-User-Id が無いリクエストではレコード側の user_id が操作者になる
  @Bean
  public IdentityResolver mdcIdentityResolver() {
    return () -> MDC.get(RequestMdcInterceptor.USER_ID_KEY);
  }
}
