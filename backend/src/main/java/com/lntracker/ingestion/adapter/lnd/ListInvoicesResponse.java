package com.lntracker.ingestion.adapter.lnd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ListInvoicesResponse(List<LndInvoice> invoices, long firstIndexOffset, long lastIndexOffset) {

    public List<LndInvoice> invoices() {
        return invoices != null ? invoices : List.of();
    }
}
