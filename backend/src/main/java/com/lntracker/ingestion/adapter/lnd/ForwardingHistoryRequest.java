package com.lntracker.ingestion.adapter.lnd;

public record ForwardingHistoryRequest(long indexOffset, int numMaxEvents) {
}
