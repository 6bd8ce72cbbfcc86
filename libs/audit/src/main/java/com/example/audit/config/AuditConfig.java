/*
 * どこで: 監査エンジンの Spring 構成
 * 何を: 型レジストリ/スキーマ登録/差分/書き込み/照会/登録口を組み立てる
 * なぜ: ホストが @Import するだけで監査を使えるようにするため
 */
package com.example.audit.config;

import com.example.audit.context.ChangeContextHolder;
import com.example.audit.context.IdentityResolver;
import com.example.audit.diff.DiffEngine;
import com.example.audit.diff.DirtyStateOracle;
import com.example.audit.diff.SnapshotDirtyStateOracle;
import com.example.audit.repository.AuditFieldRepository;
import com.example.audit.repository.AuditResourceRepository;
import com.example.audit.repository.AuditTableRepository;
import com.example.audit.repository.ChangeLogRepository;
import com.example.audit.retrieval.ChangeRetriever;
import com.example.audit.schema.TrackedSchemaDeclarer;
import com.example.audit.schema.TrackedSchemaRegistry;
import com.example.audit.serializer.TypeHandlerRegistrar;
import com.example.audit.serializer.TypeRegistry;
import com.example.audit.session.ChangeRecorder;
import com.example.audit.writer.AuditIdentityCache;
import com.example.audit.writer.AuditWriter;
import com.example.common.config.TimeConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@Configuration
@Import(TimeConfig.class)
@EnableConfigurationProperties(AuditProperties.class)
@ComponentScan(basePackageClasses = AuditTableRepository.class)
public class AuditConfig {

  // スキーマ宣言がハンドラの有無を検証するため、登録はここで先に済ませる
  @Bean
  public TypeRegistry auditTypeRegistry(ObjectProvider<TypeHandlerRegistrar> registrars) {
    final TypeRegistry registry = new TypeRegistry();
    registrars.orderedStream().forEach(registrar -> registrar.registerHandlers(registry));
    return registry;
  }

  @Bean
  public TrackedSchemaRegistry trackedSchemaRegistry(
      TypeRegistry auditTypeRegistry,
      AuditProperties properties,
      ObjectProvider<TrackedSchemaDeclarer> declarers) {
    final TrackedSchemaRegistry registry =
        new TrackedSchemaRegistry(auditTypeRegistry, properties.defaultUserIdField());
    declarers.orderedStream().forEach(declarer -> declarer.declare(registry));
    return registry;
  }

  @Bean
  public ChangeContextHolder changeContextHolder(ObjectProvider<IdentityResolver> identityResolver) {
    return new ChangeContextHolder(identityResolver.getIfAvailable(() -> IdentityResolver.NONE));
  }

  @Bean
  public AuditMetrics auditMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
    return new AuditMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
  }

  @Bean
  public DiffEngine auditDiffEngine(TypeRegistry auditTypeRegistry) {
    return new DiffEngine(auditTypeRegistry);
  }

  @Bean
  public AuditIdentityCache auditIdentityCache() {
    return new AuditIdentityCache();
  }

  @Bean
  public AuditWriter auditWriter(
      AuditTableRepository tableRepository,
      AuditFieldRepository fieldRepository,
      AuditResourceRepository resourceRepository,
      ChangeLogRepository changeLogRepository,
      AuditIdentityCache auditIdentityCache,
      AuditMetrics auditMetrics,
      Clock clock) {
    return new AuditWriter(
        tableRepository,
        fieldRepository,
        resourceRepository,
        changeLogRepository,
        auditIdentityCache,
        auditMetrics,
        clock);
  }

  @Bean
  public ChangeRetriever changeRetriever(
      TrackedSchemaRegistry trackedSchemaRegistry,
      TypeRegistry auditTypeRegistry,
      AuditTableRepository tableRepository,
      ChangeLogRepository changeLogRepository,
      AuditMetrics auditMetrics) {
    return new ChangeRetriever(
        trackedSchemaRegistry,
        auditTypeRegistry,
        tableRepository,
        changeLogRepository,
        auditMetrics);
  }

  @Bean
  public ChangeRecorder changeRecorder(
      AuditProperties properties,
      TrackedSchemaRegistry trackedSchemaRegistry,
      ChangeContextHolder changeContextHolder,
      ObjectProvider<DirtyStateOracle> dirtyStateOracle,
      DiffEngine auditDiffEngine,
      AuditWriter auditWriter,
      AuditMetrics auditMetrics,
      Clock clock) {
    return new ChangeRecorder(
        properties.enabled(),
        trackedSchemaRegistry,
        changeContextHolder,
        dirtyStateOracle.getIfAvailable(SnapshotDirtyStateOracle::new),
        auditDiffEngine,
        auditWriter,
        auditMetrics,
        clock);
  }
}
