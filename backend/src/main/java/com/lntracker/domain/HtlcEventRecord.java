package com.lntracker.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "htlc_events")
@CompoundIndex(name = "node_timestamp", def = "{'nodeId': 1, 'timestampNs': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class HtlcEventRecord implements TrackedRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String nodeId;
    private long timestampNs;
    /** FORWARD, FORWARD_FAIL, SETTLE, LINK_FAIL, FINAL. */
    private String kind;
    private String eventType;
    private String incomingChannelId;
    private String outgoingChannelId;
    private long incomingHtlcId;
    private long outgoingHtlcId;
    /** Event specific payload as received. */
    private org.bson.Document detail;
    private Instant recordedAt;

    public static String idFor(String nodeId, String incomingChannelId, long incomingHtlcId,
                               String outgoingChannelId, long outgoingHtlcId, long timestampNs, String kind) {
        return String.join(":", nodeId, incomingChannelId, String.valueOf(incomingHtlcId),
                outgoingChannelId, String.valueOf(outgoingHtlcId), String.valueOf(timestampNs), kind);
    }
}
