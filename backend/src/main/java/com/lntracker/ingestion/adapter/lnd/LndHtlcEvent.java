package com.lntracker.ingestion.adapter.lnd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Router HTLC event. Exactly one of the event objects is set; {@link #kind()} tells which.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LndHtlcEvent(
        String incomingChannelId,
        String outgoingChannelId,
        long incomingHtlcId,
        long outgoingHtlcId,
        long timestampNs,
        String eventType,
        JsonNode forwardEvent,
        JsonNode forwardFailEvent,
        JsonNode settleEvent,
        JsonNode linkFailEvent,
        JsonNode finalHtlcEvent,
        JsonNode subscribedEvent
) {

    public String kind() {
        if (forwardEvent != null) {
            return "FORWARD";
        }
        if (forwardFailEvent != null) {
            return "FORWARD_FAIL";
        }
        if (settleEvent != null) {
            return "SETTLE";
        }
        if (linkFailEvent != null) {
            return "LINK_FAIL";
        }
        if (finalHtlcEvent != null) {
            return "FINAL";
        }
        if (subscribedEvent != null) {
            return "SUBSCRIBED";
        }
        return "UNKNOWN";
    }

    /**
     * The event specific object, or null for an event without one.
     */
    public JsonNode detail() {
        if (forwardEvent != null) {
            return forwardEvent;
        }
        if (forwardFailEvent != null) {
            return forwardFailEvent;
        }
        if (settleEvent != null) {
            return settleEvent;
        }
        if (linkFailEvent != null) {
            return linkFailEvent;
        }
        if (finalHtlcEvent != null) {
            return finalHtlcEvent;
        }
        return subscribedEvent;
    }
}
