package com.lntracker.ingestion.adapter.lnd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LndForwardingEvent(
        long timestampNs,
        String chanIdIn,
        String chanIdOut,
        long amtInMsat,
        long amtOutMsat,
        long feeMsat
) {
}
