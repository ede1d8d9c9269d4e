package com.asiainfo.pivot.infra.persistence;

import com.asiainfo.pivot.config.PivotConfig;
import com.asiainfo.pivot.core.exception.IllegalRollupTransitionException;
import com.asiainfo.pivot.core.model.Rollup;
import com.asiainfo.pivot.core.model.RollupStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonRollupCatalogStoreTest {

    private static final String TABLE = "search_events";

    private JsonRollupCatalogStore store;

    @BeforeEach
    void setUp() {
        store = new JsonRollupCatalogStore(new ObjectMapper().findAndRegisterModules(), PivotConfig.defaults());
    }

    @Test
    void testSeedLoaded() {
        List<Rollup> rollups = store.listRollups(TABLE);

        assertEquals(List.of("rollup_date", "rollup_country_date", "rollup_channel_date"),
                rollups.stream().map(Rollup::id).toList());
        Rollup daily = rollups.get(0);
        assertEquals(RollupStatus.READY, daily.status());
        assertEquals("rollups.rollup_date", daily.tablePath());
        assertEquals(LocalDate.of(2025, 1, 1), daily.minDate());
        assertEquals(Instant.parse("2025-01-03T02:00:00Z"), daily.lastRefreshAt());
        assertEquals(RollupStatus.PENDING, rollups.get(2).status());
    }

    @Test
    void testUnknownTableHasNoRollups() {
        assertTrue(store.listRollups("no_such_table").isEmpty());
    }

    @Test
    void testUpdateReplacesSnapshot() {
        List<Rollup> before = store.listRollups(TABLE);

        Rollup creating = store.update(TABLE, "rollup_channel_date", Rollup::markBuilding);
        assertEquals(RollupStatus.CREATING, creating.status());

        Rollup ready = store.update(TABLE, "rollup_channel_date",
                r -> r.markReady(10, 2048, LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31), Instant.EPOCH));
        assertEquals(RollupStatus.READY, ready.status());
        assertEquals(10, ready.rowCount());

        // 旧快照不受影响
        assertEquals(RollupStatus.PENDING, before.get(2).status());
        assertEquals(RollupStatus.READY, store.listRollups(TABLE).get(2).status());
    }

    @Test
    void testIllegalTransitionKeepsCatalog() {
        assertThrows(IllegalRollupTransitionException.class,
                () -> store.update(TABLE, "rollup_date", r -> r.markReady(1, 1, null, null, Instant.EPOCH)));
        assertEquals(RollupStatus.READY, store.listRollups(TABLE).get(0).status());
    }

    @Test
    void testUpdateMissingRollup() {
        assertThrows(IllegalArgumentException.class, () -> store.update(TABLE, "rollup_device", Rollup::markStale));
    }

    @Test
    void testRegisterReplacesById() {
        store.register(TABLE, Rollup.pending("rollup_device_date", "rollups.rollup_device_date", List.of("date", "device")));
        store.register(TABLE, Rollup.pending("rollup_date", "rollups.rollup_date_v2", List.of("date")));

        List<Rollup> rollups = store.listRollups(TABLE);
        assertEquals(4, rollups.size());
        assertEquals("rollup_date", rollups.get(3).id());
        assertEquals("rollups.rollup_date_v2", rollups.get(3).tablePath());
        assertEquals(RollupStatus.PENDING, rollups.get(3).status());
    }
}
