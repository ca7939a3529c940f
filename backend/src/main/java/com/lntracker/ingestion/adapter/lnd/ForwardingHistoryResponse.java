package com.lntracker.ingestion.adapter.lnd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ForwardingHistoryResponse(List<LndForwardingEvent> forwardingEvents, long lastOffsetIndex) {

    public List<LndForwardingEvent> forwardingEvents() {
        return forwardingEvents != null ? forwardingEvents : List.of();
    }
}
