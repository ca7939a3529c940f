package com.lntracker.ingestion.adapter.lnd;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Peer connection change; {@code type} is PEER_ONLINE or PEER_OFFLINE.
 */
public record LndPeerEvent(String pubKey, String type, JsonNode payload) implements LndRawEvent {

    public static LndPeerEvent fromJson(JsonNode node) {
        return new LndPeerEvent(node.path("pub_key").asText(null), node.path("type").asText("PEER_ONLINE"), node);
    }
}
