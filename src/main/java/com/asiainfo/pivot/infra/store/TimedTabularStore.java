package com.asiainfo.pivot.infra.store;

import com.asiainfo.pivot.core.generator.GroupedFetchSpec;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * 给取数加上耗时埋点与 SQL 日志的装饰器
 */
public class TimedTabularStore implements TabularStore {

    private static final Logger log = LoggerFactory.getLogger(TimedTabularStore.class);

    private final TabularStore delegate;
    private final MeterRegistry registry;

    public TimedTabularStore(TabularStore delegate, MeterRegistry registry) {
        this.delegate = delegate;
        this.registry = registry;
    }

    @Override
    public List<Map<String, Object>> execute(GroupedFetchSpec spec) {
        if (log.isDebugEnabled()) {
            log.debug("Fetch [{}] {}:\n{}", spec.kind().tag(), spec.fingerprint(), spec.toSql());
        }
        // 【埋点】记录取数耗时
        return Timer.builder("pivot.fetch.time")
                .description("Grouped fetch execution time")
                .tag("kind", spec.kind().tag())
                .register(registry)
                .record(() -> delegate.execute(spec));
    }
}
