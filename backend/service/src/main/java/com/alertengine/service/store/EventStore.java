package com.alertengine.service.store;

import com.alertengine.core.events.Event;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface EventStore {
    void append(Event event);

    /**
     * Events at or after {@code since}, oldest first, keeping only the newest {@code limit}.
     */
    List<Event> query(Instant since, Optional<String> type, int limit);
}
