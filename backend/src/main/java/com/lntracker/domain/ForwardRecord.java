package com.lntracker.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Successful forward through the node. lnd gives forwards no index, so the id combines the
 * nanosecond timestamp with both channels.
 */
@Document(collection = "forwards")
@CompoundIndex(name = "node_timestamp", def = "{'nodeId': 1, 'timestampNs': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ForwardRecord implements TrackedRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String nodeId;
    private long timestampNs;
    private String chanIdIn;
    private String chanIdOut;
    private long amtInMsat;
    private long amtOutMsat;
    private long feeMsat;
    private Instant recordedAt;

    public static String idFor(String nodeId, long timestampNs, String chanIdIn, String chanIdOut) {
        return nodeId + ":" + timestampNs + ":" + chanIdIn + ":" + chanIdOut;
    }
}
