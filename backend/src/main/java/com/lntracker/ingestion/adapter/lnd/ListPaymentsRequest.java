package com.lntracker.ingestion.adapter.lnd;

/**
 * @param creationDateStart unix seconds, null for no lower bound
 */
public record ListPaymentsRequest(boolean includeIncomplete, long indexOffset, int maxPayments, Long creationDateStart) {
}
