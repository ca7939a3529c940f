package com.lntracker.ingestion.adapter.lnd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Invoice as returned by {@code /v1/invoices} and {@code /v1/invoices/subscribe}.
 * {@code rHash} is base64 encoded by the REST gateway.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LndInvoice(
        String rHash,
        String paymentRequest,
        long valueMsat,
        long amtPaidMsat,
        long creationDate,
        long settleDate,
        String state,
        long addIndex,
        long settleIndex
) {

    public boolean isSettled() {
        return "SETTLED".equals(state);
    }
}
