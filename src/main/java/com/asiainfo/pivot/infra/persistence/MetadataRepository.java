package com.asiainfo.pivot.infra.persistence;

import com.asiainfo.pivot.config.PivotConfig;
import com.asiainfo.pivot.core.exception.SchemaMissingException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * schema 元数据仓库
 * 缓存已编译的 SchemaContext，公式解析与循环检测只在加载时做一次。
 */
@ApplicationScoped
public class MetadataRepository {

    private static final Logger log = LoggerFactory.getLogger(MetadataRepository.class);

    private final SchemaStore schemaStore;
    private final Cache<String, SchemaContext> cache;

    @Inject
    public MetadataRepository(SchemaStore schemaStore, PivotConfig config) {
        this.schemaStore = schemaStore;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(config.getSchemaCacheTtlSeconds(), TimeUnit.SECONDS)
                .maximumSize(config.getSchemaCacheMaxSize())
                .recordStats()
                .build();
    }

    public SchemaContext context(String table) {
        return cache.get(table, this::load);
    }

    private SchemaContext load(String table) {
        log.info("Schema Cache MISS: {}", table);
        SchemaContext context = schemaStore.load(table)
                .map(SchemaContext::compile)
                .orElseThrow(() -> new SchemaMissingException(table));
        log.info("Compiled schema for {}: derived evaluation order {}", table, context.catalog().evaluationOrder());
        return context;
    }

    public void invalidate(String table) {
        cache.invalidate(table);
        log.info("Schema cache invalidated: {} ({})", table, getStats());
    }

    /**
     * 获取缓存统计
     */
    public String getStats() {
        var stats = cache.stats();
        return String.format("Schema cache stats: hitRate=%.2f%%, size=%d, hits=%d, misses=%d",
                stats.hitRate() * 100,
                cache.estimatedSize(),
                stats.hitCount(),
                stats.missCount());
    }
}
