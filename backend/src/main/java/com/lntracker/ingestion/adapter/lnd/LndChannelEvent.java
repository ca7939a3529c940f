package com.lntracker.ingestion.adapter.lnd;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Channel event update kept as received; {@code type} is e.g. OPEN_CHANNEL, ACTIVE_CHANNEL.
 */
public record LndChannelEvent(String type, JsonNode payload) implements LndRawEvent {

    public static LndChannelEvent fromJson(JsonNode node) {
        return new LndChannelEvent(node.path("type").asText("UNKNOWN"), node);
    }
}
