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
 * Outgoing payment in a final state (SUCCEEDED or FAILED). Keyed by (nodeId, paymentIndex).
 */
@Document(collection = "payments")
@CompoundIndex(name = "node_payment_index", def = "{'nodeId': 1, 'paymentIndex': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PaymentRecord implements TrackedRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String nodeId;
    private long paymentIndex;
    private String paymentHash;
    private String paymentRequest;
    private long valueMsat;
    private long feeMsat;
    private String status;
    private String failureReason;
    private Instant createdAt;
    private Instant recordedAt;

    public static String idFor(String nodeId, long paymentIndex) {
        return nodeId + ":" + paymentIndex;
    }
}
