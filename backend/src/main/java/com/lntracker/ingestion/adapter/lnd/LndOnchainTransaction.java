package com.lntracker.ingestion.adapter.lnd;

import com.fasterxml.jackson.databind.JsonNode;

public record LndOnchainTransaction(String txHash, int numConfirmations, JsonNode payload) implements LndRawEvent {

    public static LndOnchainTransaction fromJson(JsonNode node) {
        return new LndOnchainTransaction(node.path("tx_hash").asText(null), node.path("num_confirmations").asInt(0), node);
    }

    /** UNCONFIRMED when first seen in the mempool, CONFIRMED afterwards. */
    @Override
    public String type() {
        return numConfirmations > 0 ? "CONFIRMED" : "UNCONFIRMED";
    }
}
