package com.asiainfo.pivot.infra.persistence;

import com.asiainfo.pivot.config.PivotConfig;
import com.asiainfo.pivot.core.model.Rollup;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * 以 <pivot.config.location>/<table>/rollups.json 为初始内容的内存 rollup 目录
 * 每张表的列表写时复制，读者无需加锁。
 */
@ApplicationScoped
@DefaultBean
public class JsonRollupCatalogStore implements RollupCatalogStore {

    private static final Logger log = LoggerFactory.getLogger(JsonRollupCatalogStore.class);
    static final String FILE_NAME = "rollups.json";

    private final ObjectMapper objectMapper;
    private final PivotConfig config;
    private final Map<String, List<Rollup>> catalogs = new ConcurrentHashMap<>();

    @Inject
    public JsonRollupCatalogStore(ObjectMapper objectMapper, PivotConfig config) {
        this.objectMapper = objectMapper;
        this.config = config;
    }

    @Override
    public List<Rollup> listRollups(String table) {
        return catalogs.computeIfAbsent(table, this::loadSeed);
    }

    @Override
    public Rollup update(String table, String rollupId, UnaryOperator<Rollup> transition) {
        Rollup[] updated = new Rollup[1];
        catalogs.compute(table, (key, current) -> {
            List<Rollup> rollups = new ArrayList<>(current == null ? loadSeed(key) : current);
            for (int i = 0; i < rollups.size(); i++) {
                if (rollups.get(i).id().equals(rollupId)) {
                    Rollup before = rollups.get(i);
                    updated[0] = transition.apply(before);
                    rollups.set(i, updated[0]);
                    log.info("Rollup {} of {}: {} -> {}", rollupId, table, before.status().code(), updated[0].status().code());
                    return List.copyOf(rollups);
                }
            }
            throw new IllegalArgumentException("Rollup not found: " + rollupId + " (table " + table + ")");
        });
        return updated[0];
    }

    @Override
    public void register(String table, Rollup rollup) {
        catalogs.compute(table, (key, current) -> {
            List<Rollup> rollups = new ArrayList<>(current == null ? loadSeed(key) : current);
            rollups.removeIf(r -> r.id().equals(rollup.id()));
            rollups.add(rollup);
            return List.copyOf(rollups);
        });
        log.info("Registered rollup {} for {} with dimensions {}", rollup.id(), table, rollup.dimensions());
    }

    private List<Rollup> loadSeed(String table) {
        try {
            Optional<InputStream> source = ConfigFiles.open(config.getConfigLocation(), table, FILE_NAME);
            if (source.isEmpty()) {
                log.info("No rollups configured for table {}", table);
                return List.of();
            }
            try (InputStream in = source.get()) {
                List<Rollup> rollups = objectMapper.readerFor(new TypeReference<List<Rollup>>() {})
                        .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                        .readValue(in);
                log.info("Loaded {} rollups for table {}", rollups.size(), table);
                return List.copyOf(rollups);
            }
        } catch (IOException e) {
            log.error("Failed to read rollups for table {}", table, e);
            throw new UncheckedIOException("Failed to read rollups for table " + table, e);
        }
    }
}
