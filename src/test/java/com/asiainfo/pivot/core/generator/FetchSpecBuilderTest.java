package com.asiainfo.pivot.core.generator;

import com.asiainfo.pivot.SearchFixtures;
import com.asiainfo.pivot.core.model.DatePreset;
import com.asiainfo.pivot.core.model.FilterSpec;
import com.asiainfo.pivot.core.model.Granularity;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FetchSpecBuilderTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 5, 14);
    private static final FetchTarget ROLLUP = FetchTarget.rollup("rollups.rollup_country_date", true);
    private static final FetchTarget RAW = FetchTarget.raw("search_events");

    private final FetchSpecBuilder builder =
            new FetchSpecBuilder(SearchFixtures.catalog(), SearchFixtures.dimensions(), TODAY);

    private static FilterSpec januaryUsOrNull() {
        return new FilterSpec(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31), null,
                Map.of("country", List.of("US", "__NULL__")));
    }

    @Test
    void testRollupFetchSumsStoredVolumes() {
        GroupedFetchSpec spec = builder.pivot(ROLLUP, List.of("country"), List.of("queries", "clicks"),
                januaryUsOrNull(), 50, 0, List.of());

        String expected = """
                SELECT country, SUM(queries) AS queries, SUM(clicks) AS clicks
                FROM `rollups.rollup_country_date`
                WHERE date >= '2025-01-01'
                  AND date <= '2025-01-31'
                  AND (country = 'US' OR country IS NULL)
                GROUP BY country
                ORDER BY queries DESC, country
                LIMIT 50
                OFFSET 0""";
        assertEquals(expected, spec.toSql());
        assertEquals(FetchKind.PIVOT, spec.kind());
    }

    @Test
    void testRawFetchUsesFullAggregation() {
        GroupedFetchSpec spec = builder.pivot(RAW, List.of("country"), List.of("queries", "visitors"),
                FilterSpec.none(), 10, 20, List.of());

        String expected = """
                SELECT country_code AS country, SUM(queries) AS queries, COUNT(DISTINCT visitor_id) AS visitors
                FROM `search_events`
                GROUP BY country_code
                ORDER BY queries DESC, country
                LIMIT 10
                OFFSET 20""";
        assertEquals(expected, spec.toSql());
    }

    @Test
    void testTrendsTruncateDateAndKeepAllPeriods() {
        GroupedFetchSpec spec = builder.trends(RAW, List.of("queries"),
                FilterSpec.between(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31)), Granularity.WEEKLY);

        String expected = """
                SELECT DATE_TRUNC(event_date, WEEK(MONDAY)) AS date, SUM(queries) AS queries
                FROM `search_events`
                WHERE event_date >= '2025-01-01'
                  AND event_date <= '2025-01-31'
                GROUP BY date
                ORDER BY date""";
        assertEquals(expected, spec.toSql());
        assertEquals(FetchKind.TRENDS, spec.kind());
        assertNull(spec.limit());
    }

    @Test
    void testRawFilterUsesColumnNamesAndTypedLiterals() {
        FilterSpec filters = new FilterSpec(null, null, DatePreset.LAST_7_DAYS,
                Map.of("position", List.of("3", "5")));
        String sql = builder.pivot(RAW, List.of(), List.of("queries"), filters, 50, 0, List.of()).toSql();

        assertTrue(sql.contains("event_date >= '2025-05-08'"), sql);
        assertTrue(sql.contains("event_date <= '2025-05-14'"), sql);
        assertTrue(sql.contains("position IN (3, 5)"), sql);
        assertFalse(sql.contains("GROUP BY"), sql);
    }

    @Test
    void testInvalidIntegerFilterRejected() {
        FilterSpec filters = new FilterSpec(null, null, null, Map.of("position", List.of("first")));
        assertThrows(IllegalArgumentException.class,
                () -> builder.pivot(RAW, List.of(), List.of("queries"), filters, 50, 0, List.of()));
    }

    @Test
    void testDimensionValuesRestrictionDropsPaging() {
        GroupedFetchSpec spec = builder.pivot(ROLLUP, List.of("country", "device"), List.of("queries"),
                FilterSpec.none(), 50, 100, List.of("US - mobile", "DE - __NULL__"));

        assertNull(spec.limit());
        String sql = spec.toSql();
        assertTrue(sql.contains("CONCAT(COALESCE(CAST(country AS STRING), '__NULL__'), ' - ', "
                + "COALESCE(CAST(device AS STRING), '__NULL__')) IN ('US - mobile', 'DE - __NULL__')"), sql);
        assertTrue(sql.endsWith("ORDER BY country, device"), sql);
    }

    @Test
    void testSingleDimensionRestrictionIsPlainIn() {
        String sql = builder.pivot(ROLLUP, List.of("country"), List.of("queries"),
                FilterSpec.none(), 50, 0, List.of("US", "DE")).toSql();
        assertTrue(sql.contains("WHERE country IN ('US', 'DE')"), sql);
    }

    @Test
    void testTotalCountWrapsGroupedSubquery() {
        GroupedFetchSpec spec = builder.totalCount(RAW, List.of("country", "device"),
                FilterSpec.between(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31)));

        assertTrue(spec.countGroups());
        String sql = spec.toSql();
        assertTrue(sql.startsWith("SELECT COUNT(*) AS total_count\nFROM (\n  SELECT country_code, device"), sql);
        assertTrue(sql.contains("GROUP BY country_code, device"), sql);
        assertTrue(sql.endsWith(")"), sql);

        assertThrows(IllegalArgumentException.class, () -> builder.totalCount(RAW, List.of(), FilterSpec.none()));
    }

    @Test
    void testDataDateRange() {
        String sql = builder.dateRange(RAW, FilterSpec.none()).toSql();
        assertEquals("SELECT MIN(event_date) AS min_date, MAX(event_date) AS max_date\nFROM `search_events`", sql);
    }

    @Test
    void testDimensionValuesOrderedBySortMetricOnRollup() {
        String sql = builder.dimensionValues(ROLLUP, "country", FilterSpec.none(), 100, "queries").toSql();
        String expected = """
                SELECT country AS value, SUM(queries) AS sort_metric
                FROM `rollups.rollup_country_date`
                WHERE country IS NOT NULL
                GROUP BY country
                ORDER BY sort_metric DESC, value
                LIMIT 100
                OFFSET 0""";
        assertEquals(expected, sql);

        String raw = builder.dimensionValues(RAW, "country", FilterSpec.none(), 100, "queries").toSql();
        assertFalse(raw.contains("sort_metric"), raw);
        assertTrue(raw.contains("ORDER BY value"), raw);
    }

    @Test
    void testStringLiteralEscaping() {
        FilterSpec filters = new FilterSpec(null, null, null, Map.of("search_term", List.of("men's shoes")));
        String sql = builder.pivot(ROLLUP, List.of(), List.of("queries"), filters, 50, 0, List.of()).toSql();
        assertTrue(sql.contains("search_term = 'men''s shoes'"), sql);
    }

    @Test
    void testNullOnlyFilter() {
        FilterSpec filters = new FilterSpec(null, null, null, Map.of("device", List.of("__NULL__")));
        String sql = builder.pivot(ROLLUP, List.of(), List.of("queries"), filters, 50, 0, List.of()).toSql();
        assertTrue(sql.contains("WHERE device IS NULL"), sql);
    }

    @Test
    void testDerivedMetricIsNeverFetched() {
        assertThrows(IllegalArgumentException.class,
                () -> builder.pivot(ROLLUP, List.of(), List.of("ctr"), FilterSpec.none(), 50, 0, List.of()));
    }

    @Test
    void testFingerprint() {
        GroupedFetchSpec a = builder.pivot(ROLLUP, List.of("country"), List.of("queries"), januaryUsOrNull(), 50, 0, List.of());
        GroupedFetchSpec b = builder.pivot(ROLLUP, List.of("country"), List.of("queries"), januaryUsOrNull(), 50, 0, List.of());
        GroupedFetchSpec c = builder.pivot(ROLLUP, List.of("country"), List.of("queries"), januaryUsOrNull(), 51, 0, List.of());

        assertTrue(a.fingerprint().matches("[0-9a-f]{64}"));
        assertEquals(a.fingerprint(), b.fingerprint());
        assertNotEquals(a.fingerprint(), c.fingerprint());
    }

    @Test
    void testFingerprintIsSha256OfRenderedSql() {
        GroupedFetchSpec spec = builder.pivot(RAW, List.of("device"), List.of("queries"), FilterSpec.none(), 10, 0, List.of());
        assertEquals(DigestUtils.sha256Hex(spec.toSql()), spec.fingerprint());
        assertEquals(DigestUtils.sha256Hex(SqlRenderer.render(spec)), spec.fingerprint());
    }
}
