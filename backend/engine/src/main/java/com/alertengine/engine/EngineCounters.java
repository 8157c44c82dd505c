package com.alertengine.engine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

final class EngineCounters {
    final LongAdder created = new LongAdder();
    final LongAdder deduplicated = new LongAdder();
    final LongAdder suppressed = new LongAdder();
    final LongAdder notified = new LongAdder();
    final LongAdder notificationFailures = new LongAdder();
    final LongAdder bookkeepingFailures = new LongAdder();

    Map<String, Long> snapshot(long scoringDegradations) {
        Map<String, Long> counters = new LinkedHashMap<>();
        counters.put("alertsCreated", created.sum());
        counters.put("alertsDeduplicated", deduplicated.sum());
        counters.put("alertsSuppressed", suppressed.sum());
        counters.put("notificationsSent", notified.sum());
        counters.put("notificationFailures", notificationFailures.sum());
        counters.put("bookkeepingFailures", bookkeepingFailures.sum());
        counters.put("scoringDegradations", scoringDegradations);
        return counters;
    }
}
