package com.asiainfo.pivot.core.engine;

import com.asiainfo.pivot.SearchFixtures;
import com.asiainfo.pivot.core.generator.FetchSpecBuilder;
import com.asiainfo.pivot.core.generator.FetchTarget;
import com.asiainfo.pivot.core.model.FilterSpec;
import com.asiainfo.pivot.core.model.MetricRow;
import com.asiainfo.pivot.core.model.PivotRow;
import com.asiainfo.pivot.core.parser.MetricCatalog;
import com.asiainfo.pivot.infra.store.InMemoryTabularStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PivotRowBuilderTest {

    private AggregationEngine engine;
    private PivotRowBuilder builder;

    @BeforeEach
    void setUp() {
        MetricCatalog catalog = SearchFixtures.catalog();
        InMemoryTabularStore store = new InMemoryTabularStore();
        store.register("rollups.rollup_country_date", SearchFixtures.countryDateRows());
        engine = new AggregationEngine(catalog,
                new FetchSpecBuilder(catalog, SearchFixtures.dimensions(), LocalDate.of(2025, 5, 14)), store);
        builder = new PivotRowBuilder(engine);
    }

    @Test
    void testCompositeDimensionValue() {
        MetricRow row = new MetricRow().putDimension("country", "US").putDimension("device", "mobile");
        assertEquals("US - mobile", PivotRowBuilder.dimensionValue(row, List.of("country", "device")));

        MetricRow withNull = new MetricRow().putDimension("country", null).putDimension("device", "");
        assertEquals("__NULL__ - ", PivotRowBuilder.dimensionValue(withNull, List.of("country", "device")));
        assertEquals("All", PivotRowBuilder.dimensionValue(row, List.of()));
    }

    @Test
    void testRowsCarryPercentagesPerMetric() {
        List<MetricRow> rows = engine.aggregate(List.of("country"), List.of("queries", "ctr"), FilterSpec.none(),
                FetchTarget.rollup("rollups.rollup_country_date", true), 50, 0, List.of());
        List<PivotRow> pivotRows = builder.buildRows(rows, List.of("country"), List.of("queries", "ctr"));

        PivotRow us = pivotRows.get(0);
        assertEquals("US", us.dimensionValue());
        assertEquals(List.of("queries", "ctr", "queries_pct", "ctr_pct"), List.copyOf(us.metrics().keySet()));
        assertEquals(150.0, us.metrics().get("queries"));
        assertEquals(75.0, us.metrics().get("queries_pct"));
        assertEquals(75.0, us.percentageOfTotal(), 1e-9);
        assertTrue(us.hasChildren());
        // 0.25 / (0.25 + 1/3)
        assertEquals(42.86, us.metrics().get("ctr_pct"));

        double sum = pivotRows.stream().mapToDouble(PivotRow::percentageOfTotal).sum();
        assertEquals(100.0, sum, 1e-9);
    }

    @Test
    void testTotalRowPercentagesAreHundred() {
        List<MetricRow> rows = engine.aggregate(List.of("country"), List.of("queries", "ctr"), FilterSpec.none(),
                FetchTarget.rollup("rollups.rollup_country_date", true), 50, 0, List.of());
        PivotRow total = builder.buildTotal(engine.totalRow(rows, List.of("queries", "ctr")), List.of("queries", "ctr"));

        assertEquals("Total", total.dimensionValue());
        assertEquals(100.0, total.percentageOfTotal());
        assertEquals(100.0, total.metrics().get("queries_pct"));
        assertEquals(100.0, total.metrics().get("ctr_pct"));
        assertEquals(200.0, total.metrics().get("queries"));
        assertFalse(total.hasChildren());
    }

    @Test
    void testNoDimensionsGivesSingleAllRow() {
        List<MetricRow> rows = engine.aggregate(List.of(), List.of("queries"), FilterSpec.none(),
                FetchTarget.rollup("rollups.rollup_country_date", true), 50, 0, List.of());
        List<PivotRow> pivotRows = builder.buildRows(rows, List.of(), List.of("queries"));

        assertEquals(1, pivotRows.size());
        assertEquals("All", pivotRows.get(0).dimensionValue());
        assertFalse(pivotRows.get(0).hasChildren());
        assertEquals(100.0, pivotRows.get(0).percentageOfTotal());
    }
}
