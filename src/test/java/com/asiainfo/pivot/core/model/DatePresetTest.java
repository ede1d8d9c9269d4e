package com.asiainfo.pivot.core.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class DatePresetTest {

    // 周三
    private static final LocalDate TODAY = LocalDate.of(2025, 5, 14);

    private static void assertRange(DatePreset preset, String start, String end) {
        DateRange range = preset.resolve(TODAY);
        assertEquals(LocalDate.parse(start), range.start(), preset.id());
        assertEquals(LocalDate.parse(end), range.end(), preset.id());
    }

    @Test
    void testRollingDays() {
        assertRange(DatePreset.TODAY, "2025-05-14", "2025-05-14");
        assertRange(DatePreset.YESTERDAY, "2025-05-13", "2025-05-13");
        assertRange(DatePreset.LAST_7_DAYS, "2025-05-08", "2025-05-14");
        assertRange(DatePreset.LAST_30_DAYS, "2025-04-15", "2025-05-14");
        assertEquals(90, DatePreset.LAST_90_DAYS.resolve(TODAY).numDays());
    }

    @Test
    void testCalendarPeriods() {
        assertRange(DatePreset.THIS_WEEK, "2025-05-12", "2025-05-14");
        assertRange(DatePreset.LAST_WEEK, "2025-05-05", "2025-05-11");
        assertRange(DatePreset.LAST_MONTH, "2025-04-01", "2025-04-30");
        assertRange(DatePreset.MONTH_TO_DATE, "2025-05-01", "2025-05-14");
        assertRange(DatePreset.THIS_QUARTER, "2025-04-01", "2025-05-14");
        assertRange(DatePreset.LAST_QUARTER, "2025-01-01", "2025-03-31");
        assertRange(DatePreset.YEAR_TO_DATE, "2025-01-01", "2025-05-14");
        assertRange(DatePreset.LAST_YEAR, "2024-01-01", "2024-12-31");
    }

    @Test
    void testYearBoundary() {
        LocalDate january = LocalDate.of(2025, 1, 15);
        assertEquals(DateRange.of(LocalDate.of(2024, 10, 1), LocalDate.of(2024, 12, 31)),
                DatePreset.LAST_QUARTER.resolve(january));
        assertEquals(DateRange.of(LocalDate.of(2024, 12, 1), LocalDate.of(2024, 12, 31)),
                DatePreset.LAST_MONTH.resolve(january));
    }

    @Test
    void testFromId() {
        assertEquals(DatePreset.LAST_7_DAYS, DatePreset.fromId("last_7_days"));
        assertEquals(DatePreset.LAST_7_DAYS, DatePreset.fromId(" LAST_7_DAYS "));
        assertNull(DatePreset.fromId(null));
        assertThrows(IllegalArgumentException.class, () -> DatePreset.fromId("last_6_days"));
    }
}
