package com.asiainfo.pivot.infra.persistence;

import com.asiainfo.pivot.config.PivotConfig;
import com.asiainfo.pivot.core.model.SchemaSnapshot;
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
import java.util.Optional;

/**
 * 从 <pivot.config.location>/<table>/schema.json 读取 schema 快照
 */
@ApplicationScoped
@DefaultBean
public class JsonSchemaStore implements SchemaStore {

    private static final Logger log = LoggerFactory.getLogger(JsonSchemaStore.class);
    static final String FILE_NAME = "schema.json";

    private final ObjectMapper objectMapper;
    private final PivotConfig config;

    @Inject
    public JsonSchemaStore(ObjectMapper objectMapper, PivotConfig config) {
        this.objectMapper = objectMapper;
        this.config = config;
    }

    @Override
    public Optional<SchemaSnapshot> load(String table) {
        try {
            Optional<InputStream> source = ConfigFiles.open(config.getConfigLocation(), table, FILE_NAME);
            if (source.isEmpty()) {
                log.warn("No schema file for table {} under {}", table, config.getConfigLocation());
                return Optional.empty();
            }
            try (InputStream in = source.get()) {
                SchemaSnapshot snapshot = objectMapper.readerFor(SchemaSnapshot.class)
                        .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                        .readValue(in);
                log.info("Loaded schema for {}: {} dimensions, {} metrics, {} custom dimensions, {} custom metrics",
                        table, snapshot.dimensions().size(), snapshot.metrics().size(),
                        snapshot.customDimensions().size(), snapshot.customMetrics().size());
                return Optional.of(snapshot);
            }
        } catch (IOException e) {
            log.error("Failed to read schema for table {}", table, e);
            throw new UncheckedIOException("Failed to read schema for table " + table, e);
        }
    }
}
