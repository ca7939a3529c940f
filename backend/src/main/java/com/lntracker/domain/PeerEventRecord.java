package com.lntracker.domain;

import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Peer online/offline event.
 */
@Document(collection = "peer_events")
@CompoundIndex(name = "node_received", def = "{'nodeId': 1, 'receivedAt': 1}")
@NoArgsConstructor
public class PeerEventRecord extends RawEventRecord {
}
