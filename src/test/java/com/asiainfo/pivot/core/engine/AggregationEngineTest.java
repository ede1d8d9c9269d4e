package com.asiainfo.pivot.core.engine;

import com.asiainfo.pivot.SearchFixtures;
import com.asiainfo.pivot.core.generator.FetchSpecBuilder;
import com.asiainfo.pivot.core.generator.FetchTarget;
import com.asiainfo.pivot.core.generator.GroupedFetchSpec;
import com.asiainfo.pivot.core.model.DateRange;
import com.asiainfo.pivot.core.model.FilterSpec;
import com.asiainfo.pivot.core.model.Granularity;
import com.asiainfo.pivot.core.model.MetricRow;
import com.asiainfo.pivot.core.parser.MetricCatalog;
import com.asiainfo.pivot.infra.store.InMemoryTabularStore;
import com.asiainfo.pivot.infra.store.TabularStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.asiainfo.pivot.SearchFixtures.DAY1;
import static com.asiainfo.pivot.SearchFixtures.DAY2;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class AggregationEngineTest {

    private static final FetchTarget ROLLUP = FetchTarget.rollup("rollups.rollup_country_date", true);

    private final MetricCatalog catalog = SearchFixtures.catalog();
    private InMemoryTabularStore store;
    private AggregationEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryTabularStore();
        store.register("rollups.rollup_country_date", SearchFixtures.countryDateRows());
        engine = engine(store);
    }

    private AggregationEngine engine(TabularStore tabularStore) {
        FetchSpecBuilder builder = new FetchSpecBuilder(catalog, SearchFixtures.dimensions(), LocalDate.of(2025, 5, 14));
        return new AggregationEngine(catalog, builder, tabularStore);
    }

    private List<MetricRow> byCountry() {
        return engine.aggregate(List.of("country"), List.of("queries", "clicks", "ctr"), FilterSpec.none(),
                ROLLUP, 50, 0, List.of());
    }

    @Test
    void testReaggregatesAcrossDatesAndDerivesRatios() {
        List<MetricRow> rows = byCountry();

        assertEquals(2, rows.size());
        MetricRow us = rows.get(0);
        assertEquals("US", us.dimension("country"));
        assertEquals(150.0, us.metric("queries"));
        assertEquals(120.0, us.metric("queries_pdp"));
        assertEquals(0.25, us.metric("ctr"), 1e-9);

        MetricRow de = rows.get(1);
        assertEquals(50.0, de.metric("queries"));
        assertEquals(10.0 / 30.0, de.metric("ctr"), 1e-9);
    }

    @Test
    void testFetchGroupsByRequestedDimensionsOnly() {
        TabularStore mock = Mockito.mock(TabularStore.class);
        when(mock.execute(any())).thenReturn(List.of());
        engine(mock).aggregate(List.of("country"), List.of("ctr"), FilterSpec.none(), ROLLUP, 50, 0, List.of());

        ArgumentCaptor<GroupedFetchSpec> captor = ArgumentCaptor.forClass(GroupedFetchSpec.class);
        Mockito.verify(mock).execute(captor.capture());
        GroupedFetchSpec spec = captor.getValue();
        assertEquals(List.of("country"), spec.groupByColumns());
        assertEquals(List.of("country", "queries_pdp", "clicks"),
                spec.selectColumns().stream().map(c -> c.alias()).toList());
    }

    @Test
    void testZeroDenominatorYieldsZero() {
        FilterSpec deDay2 = new FilterSpec(DAY2, DAY2, null, Map.of("country", List.of("DE")));
        List<MetricRow> rows = engine.aggregate(List.of("country"), List.of("aov", "conversion_rate"), deDay2,
                ROLLUP, 50, 0, List.of());

        assertEquals(1, rows.size());
        assertEquals(0.0, rows.get(0).metric("aov"));
        assertEquals(0.0, rows.get(0).metric("conversion_rate"));
    }

    @Test
    void testFormulaFailureDefaultsToZero() {
        MetricRow row = new MetricRow().putDimension("country", "US").putMetric("clicks", 5.0);
        engine.computeDerivedMetrics(List.of(row), List.of("ctr"));
        assertEquals(0.0, row.metric("ctr"));
        assertEquals(5.0, row.metric("clicks"));
    }

    @Test
    void testPercentagesSumToHundred() {
        List<MetricRow> rows = byCountry();
        Map<String, Double> totals = engine.totals(rows);

        double sum = rows.stream().mapToDouble(r -> engine.percentageOfTotal(r, totals)).sum();
        assertEquals(100.0, sum, 1e-9);
        assertEquals(75.0, engine.percentageOfTotal(rows.get(0), totals), 1e-9);
    }

    @Test
    void testPercentageSkipsMetricsWithZeroTotal() {
        MetricRow a = new MetricRow().putMetric("queries", 0.0).putMetric("clicks", 5.0);
        MetricRow b = new MetricRow().putMetric("queries", 0.0).putMetric("clicks", 15.0);
        Map<String, Double> totals = engine.totals(List.of(a, b));

        assertEquals(25.0, engine.percentageOfTotal(a, totals), 1e-9);

        MetricRow empty = new MetricRow().putMetric("queries", 0.0);
        assertEquals(0.0, engine.percentageOfTotal(empty, engine.totals(List.of(empty))));
    }

    @Test
    void testTotalRowSumsVolumesAndRederivesRatios() {
        MetricRow total = engine.totalRow(byCountry(), List.of("queries", "clicks", "ctr"));

        assertEquals(200.0, total.metric("queries"));
        assertEquals(40.0, total.metric("clicks"));
        assertEquals(40.0 / 150.0, total.metric("ctr"), 1e-9);
        assertTrue(total.dimensions().isEmpty());
    }

    @Test
    void testTotalCount() {
        assertEquals(2, engine.totalCount(List.of("country"), FilterSpec.none(), ROLLUP));
        assertEquals(1, engine.totalCount(List.of(), FilterSpec.none(), ROLLUP));
        FilterSpec us = new FilterSpec(null, null, null, Map.of("country", List.of("US")));
        assertEquals(1, engine.totalCount(List.of("country"), us, ROLLUP));
    }

    @Test
    void testDataDateRange() {
        DateRange range = engine.dataDateRange(FilterSpec.none(), ROLLUP).orElseThrow();
        assertEquals(DAY1, range.start());
        assertEquals(DAY2, range.end());
        assertEquals(2, range.numDays());

        FilterSpec future = FilterSpec.between(LocalDate.of(2030, 1, 1), LocalDate.of(2030, 1, 31));
        assertTrue(engine.dataDateRange(future, ROLLUP).isEmpty());
    }

    @Test
    void testDimensionValuesSortedByMetric() {
        assertEquals(List.of("US", "DE"),
                engine.dimensionValues("country", FilterSpec.none(), ROLLUP, 10, "queries"));
        assertEquals(List.of("US"),
                engine.dimensionValues("country", FilterSpec.none(), ROLLUP, 1, "queries"));
    }

    @Test
    void testTrendsDeriveRatiosPerPeriod() {
        List<MetricRow> rows = engine.trends(List.of("queries", "ctr"), FilterSpec.none(), ROLLUP, Granularity.DAILY);

        assertEquals(2, rows.size());
        assertEquals(DAY1, rows.get(0).dimension("date"));
        assertEquals(130.0, rows.get(0).metric("queries"));
        assertEquals(0.26, rows.get(0).metric("ctr"), 1e-9);
        assertEquals(DAY2, rows.get(1).dimension("date"));
        assertEquals(0.28, rows.get(1).metric("ctr"), 1e-9);
    }
}
