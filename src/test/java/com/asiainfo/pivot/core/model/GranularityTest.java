package com.asiainfo.pivot.core.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class GranularityTest {

    @Test
    void testUnknownFallsBackToDaily() {
        assertEquals(Granularity.WEEKLY, Granularity.from(" Weekly "));
        assertEquals(Granularity.MONTHLY, Granularity.from("monthly"));
        assertEquals(Granularity.DAILY, Granularity.from("hourly"));
        assertEquals(Granularity.DAILY, Granularity.from(null));
    }

    @Test
    void testTruncate() {
        LocalDate sunday = LocalDate.of(2025, 1, 5);
        assertEquals(sunday, Granularity.DAILY.truncate(sunday));
        assertEquals(LocalDate.of(2024, 12, 30), Granularity.WEEKLY.truncate(sunday));
        assertEquals(LocalDate.of(2025, 1, 6), Granularity.WEEKLY.truncate(LocalDate.of(2025, 1, 6)));
        assertEquals(LocalDate.of(2025, 1, 1), Granularity.MONTHLY.truncate(sunday));
        assertNull(Granularity.MONTHLY.truncate(null));
    }
}
