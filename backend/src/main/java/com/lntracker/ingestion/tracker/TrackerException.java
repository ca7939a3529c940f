package com.lntracker.ingestion.tracker;

import com.lntracker.domain.TrackerCategory;

/**
 * A tracker gave up: the retry budget is spent or the upstream failed fatally.
 */
public class TrackerException extends RuntimeException {

    private final TrackerCategory category;

    public TrackerException(TrackerCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public TrackerCategory getCategory() {
        return category;
    }
}
