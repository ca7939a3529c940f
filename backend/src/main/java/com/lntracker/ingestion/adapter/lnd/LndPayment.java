package com.lntracker.ingestion.adapter.lnd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Payment as returned by {@code /v1/payments} and {@code /v2/router/payments}.
 * Status is one of IN_FLIGHT, SUCCEEDED, FAILED, INITIATED.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LndPayment(
        String paymentHash,
        String paymentRequest,
        long valueMsat,
        long feeMsat,
        long creationTimeNs,
        String status,
        String failureReason,
        long paymentIndex
) {

    public boolean isFinal() {
        return "SUCCEEDED".equals(status) || "FAILED".equals(status);
    }
}
