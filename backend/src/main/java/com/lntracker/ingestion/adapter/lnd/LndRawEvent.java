package com.lntracker.ingestion.adapter.lnd;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Stream message kept as received, with a short type label for querying.
 */
public interface LndRawEvent {

    String type();

    JsonNode payload();
}
