package com.asiainfo.pivot.config;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 透视查询配置
 */
@ApplicationScoped
public class PivotConfig {

    private static final Logger log = LoggerFactory.getLogger(PivotConfig.class);

    // 请求未指定时是否必须命中 rollup
    @ConfigProperty(name = "pivot.require-rollup", defaultValue = "true")
    boolean requireRollup;

    @ConfigProperty(name = "pivot.default-limit", defaultValue = "50")
    int defaultLimit;

    @ConfigProperty(name = "pivot.max-limit", defaultValue = "10000")
    int maxLimit;

    // true 时所有 volume 指标都按去重计数对待 (跨日期重聚合评 80 分)
    @ConfigProperty(name = "pivot.router.strict-distinct", defaultValue = "false")
    boolean strictDistinct;

    @ConfigProperty(name = "pivot.schema.cache.ttl-seconds", defaultValue = "300")
    int schemaCacheTtlSeconds;

    @ConfigProperty(name = "pivot.schema.cache.max-size", defaultValue = "100")
    int schemaCacheMaxSize;

    // classpath 前缀或文件系统目录，其下为 <table>/schema.json 与 <table>/rollups.json
    @ConfigProperty(name = "pivot.config.location", defaultValue = "pivot")
    String configLocation;

    public PivotConfig() {
    }

    public PivotConfig(boolean requireRollup, int defaultLimit, int maxLimit, boolean strictDistinct,
                       int schemaCacheTtlSeconds, int schemaCacheMaxSize, String configLocation) {
        this.requireRollup = requireRollup;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
        this.strictDistinct = strictDistinct;
        this.schemaCacheTtlSeconds = schemaCacheTtlSeconds;
        this.schemaCacheMaxSize = schemaCacheMaxSize;
        this.configLocation = configLocation;
    }

    /**
     * 与 application.properties 缺省值一致，供非容器环境使用
     */
    public static PivotConfig defaults() {
        return new PivotConfig(true, 50, 10000, false, 300, 100, "pivot");
    }

    @PostConstruct
    void init() {
        log.info("=== Pivot Configuration ===");
        log.info("Require rollup:  {}", requireRollup ? "ENABLED" : "DISABLED");
        log.info("Limits:          default {}, max {}", defaultLimit, maxLimit);
        log.info("Strict distinct: {}", strictDistinct ? "ENABLED" : "DISABLED");
        log.info("Schema cache:    TTL {}s, MaxSize {}", schemaCacheTtlSeconds, schemaCacheMaxSize);
        log.info("Config location: {}", configLocation);
        log.info("===========================");
    }

    /**
     * 请求的 limit 为空或非正时取默认值，并截断到上限
     */
    public int effectiveLimit(Integer requested) {
        if (requested == null || requested <= 0) {
            return defaultLimit;
        }
        return Math.min(requested, maxLimit);
    }

    public boolean isRequireRollup() {
        return requireRollup;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public boolean isStrictDistinct() {
        return strictDistinct;
    }

    public int getSchemaCacheTtlSeconds() {
        return schemaCacheTtlSeconds;
    }

    public int getSchemaCacheMaxSize() {
        return schemaCacheMaxSize;
    }

    public String getConfigLocation() {
        return configLocation;
    }
}
