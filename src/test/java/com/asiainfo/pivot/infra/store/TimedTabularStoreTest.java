package com.asiainfo.pivot.infra.store;

import com.asiainfo.pivot.core.generator.FetchKind;
import com.asiainfo.pivot.core.generator.GroupedFetchSpec;
import com.asiainfo.pivot.core.generator.SelectColumn;
import com.asiainfo.pivot.core.model.AggregateFunction;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class TimedTabularStoreTest {

    @Test
    void testDelegatesAndRecordsTimerPerKind() {
        TabularStore delegate = Mockito.mock(TabularStore.class);
        when(delegate.execute(any())).thenReturn(List.of(Map.of("total_count", 3L)));
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        TimedTabularStore store = new TimedTabularStore(delegate, registry);

        GroupedFetchSpec spec = new GroupedFetchSpec(FetchKind.COUNT, "search_events",
                List.of(SelectColumn.aggregate(AggregateFunction.COUNT, "*", GroupedFetchSpec.TOTAL_COUNT)),
                List.of("country"), List.of(), List.of(), null, 0, true);

        assertEquals(3L, store.execute(spec).get(0).get("total_count"));
        Timer timer = registry.find("pivot.fetch.time").tag("kind", "count").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        Mockito.verify(delegate).execute(spec);
    }
}
