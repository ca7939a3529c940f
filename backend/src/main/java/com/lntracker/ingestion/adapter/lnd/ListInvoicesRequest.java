package com.lntracker.ingestion.adapter.lnd;

/**
 * @param creationDateStart unix seconds, null for no lower bound
 */
public record ListInvoicesRequest(long indexOffset, int numMaxInvoices, Long creationDateStart) {
}
