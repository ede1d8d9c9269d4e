package com.asiainfo.pivot.infra.persistence;

import com.asiainfo.pivot.SearchFixtures;
import com.asiainfo.pivot.config.PivotConfig;
import com.asiainfo.pivot.core.exception.FormulaCompileException;
import com.asiainfo.pivot.core.exception.SchemaMissingException;
import com.asiainfo.pivot.core.exception.UnknownCustomDefinitionException;
import com.asiainfo.pivot.core.model.MetricDef;
import com.asiainfo.pivot.core.model.SchemaSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MetadataRepositoryTest {

    private SchemaStore schemaStore;
    private MetadataRepository repository;

    @BeforeEach
    void setUp() {
        schemaStore = mock(SchemaStore.class);
        repository = new MetadataRepository(schemaStore, PivotConfig.defaults());
    }

    private static SchemaSnapshot snapshot(List<MetricDef> metrics) {
        return new SchemaSnapshot(SearchFixtures.TABLE, null, new ArrayList<>(SearchFixtures.dimensions().values()), metrics, null, null, null);
    }

    @Test
    void testCompiledContextIsCached() {
        when(schemaStore.load(SearchFixtures.TABLE)).thenReturn(Optional.of(snapshot(SearchFixtures.metrics())));

        SchemaContext first = repository.context(SearchFixtures.TABLE);
        SchemaContext second = repository.context(SearchFixtures.TABLE);

        assertSame(first, second);
        verify(schemaStore, times(1)).load(SearchFixtures.TABLE);
        String stats = repository.getStats();
        assertTrue(stats.contains("hits=1"), stats);
        assertTrue(stats.contains("misses=1"), stats);
        assertTrue(stats.contains("size=1"), stats);
        assertEquals("search_events", first.snapshot().tablePath());
    }

    @Test
    void testInvalidateReloads() {
        when(schemaStore.load(SearchFixtures.TABLE)).thenReturn(Optional.of(snapshot(SearchFixtures.metrics())));

        repository.context(SearchFixtures.TABLE);
        repository.invalidate(SearchFixtures.TABLE);
        repository.context(SearchFixtures.TABLE);

        verify(schemaStore, times(2)).load(SearchFixtures.TABLE);
    }

    @Test
    void testMissingSchema() {
        when(schemaStore.load("unknown")).thenReturn(Optional.empty());
        assertThrows(SchemaMissingException.class, () -> repository.context("unknown"));
    }

    @Test
    void testCyclicFormulaRejectedAtLoad() {
        List<MetricDef> metrics = List.of(
                MetricDef.derived("a", "rate", "{b} + 1"),
                MetricDef.derived("b", "rate", "{a} * 2"));
        when(schemaStore.load(SearchFixtures.TABLE)).thenReturn(Optional.of(snapshot(metrics)));

        assertThrows(FormulaCompileException.class, () -> repository.context(SearchFixtures.TABLE));
    }

    @Test
    void testCustomDefinitionsLookup() {
        SchemaContext context = SchemaContext.compile(
                new JsonSchemaStore(new ObjectMapper().findAndRegisterModules(),
                        PivotConfig.defaults()).load(SearchFixtures.TABLE).orElseThrow());

        assertEquals("volume_tier", context.customDimension("volume_tier").id());
        assertEquals("volume_tier", context.customDimension("custom_volume_tier").id());
        assertEquals("queries", context.customMetric("queries_per_day").sourceMetric());
        assertThrows(UnknownCustomDefinitionException.class, () -> context.customDimension("nope"));
        assertThrows(UnknownCustomDefinitionException.class, () -> context.customMetric("nope"));
        assertFalse(context.availableDimensions().contains("session_id"));
    }
}
