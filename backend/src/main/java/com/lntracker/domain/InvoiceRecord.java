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
 * Settled invoice. Keyed by (nodeId, addIndex); open and cancelled invoices are not stored.
 */
@Document(collection = "invoices")
@CompoundIndex(name = "node_add_index", def = "{'nodeId': 1, 'addIndex': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class InvoiceRecord implements TrackedRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String nodeId;
    private long addIndex;
    private long settleIndex;
    /** Hex. */
    private String paymentHash;
    private String paymentRequest;
    private long valueMsat;
    private long amtPaidMsat;
    private Instant createdAt;
    private Instant settledAt;
    private Instant recordedAt;

    public static String idFor(String nodeId, long addIndex) {
        return nodeId + ":" + addIndex;
    }
}
