package com.lntracker.ingestion.adapter.lnd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ListPaymentsResponse(List<LndPayment> payments, long firstIndexOffset, long lastIndexOffset) {

    public List<LndPayment> payments() {
        return payments != null ? payments : List.of();
    }
}
