package com.lntracker.ingestion.adapter.lnd;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One graph topology update. A message can carry node updates, channel updates and closed
 * channels at once; {@code type} names the first non-empty part.
 */
public record LndGraphUpdate(String type, JsonNode payload) implements LndRawEvent {

    public static LndGraphUpdate fromJson(JsonNode node) {
        String type = "EMPTY";
        if (hasElements(node, "node_updates")) {
            type = "NODE_UPDATE";
        } else if (hasElements(node, "channel_updates")) {
            type = "CHANNEL_UPDATE";
        } else if (hasElements(node, "closed_chans")) {
            type = "CHANNEL_CLOSED";
        }
        return new LndGraphUpdate(type, node);
    }

    private static boolean hasElements(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isArray() && !value.isEmpty();
    }
}
