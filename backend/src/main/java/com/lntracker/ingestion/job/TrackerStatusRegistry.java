package com.lntracker.ingestion.job;

import com.lntracker.domain.TrackerCategory;
import com.lntracker.domain.TrackerStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory status per tracker. FAILED is final until the process restarts.
 */
@Component
public class TrackerStatusRegistry {

    public record Entry(TrackerStatus status, String lastError, Instant updatedAt) {}

    private final Map<TrackerCategory, Entry> entries = new ConcurrentHashMap<>();

    public void update(TrackerCategory category, TrackerStatus status) {
        entries.compute(category, (c, current) -> {
            if (current != null && current.status() == TrackerStatus.FAILED) {
                return current;
            }
            return new Entry(status, current != null ? current.lastError() : null, Instant.now());
        });
    }

    public void markFailed(TrackerCategory category, Throwable error) {
        entries.put(category, new Entry(TrackerStatus.FAILED, error.getMessage(), Instant.now()));
    }

    public Optional<Entry> get(TrackerCategory category) {
        return Optional.ofNullable(entries.get(category));
    }

    public Map<TrackerCategory, Entry> snapshot() {
        return entries.isEmpty() ? Map.of() : new EnumMap<>(entries);
    }
}
